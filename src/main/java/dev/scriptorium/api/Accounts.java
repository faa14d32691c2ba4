package dev.scriptorium.api;

import java.util.regex.Pattern;

/** Account scoping for the REST API. Authentication happens upstream; the header is trusted. */
final class Accounts {

  static final String HEADER = "X-Scriptorium-Account";
  static final String DEFAULT = "default";

  private static final Pattern VALID = Pattern.compile("[A-Za-z0-9._@-]{1,128}");

  private Accounts() {}

  static String requireValid(String account) {
    if (!VALID.matcher(account).matches()) {
      throw new IllegalArgumentException("Invalid account: " + account);
    }
    return account;
  }
}
