package dev.scriptorium.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based checks of {@link MarkdownChunker} over generated documents built from H2/H3
 * sections of word-only prose: no blank chunks, size bounds, slug-shaped section paths and no lost
 * words.
 */
class MarkdownChunkerPropertyTest {

  private static final int MAX = 200;
  private static final Pattern WORD = Pattern.compile("[a-z]{3,8}");
  private static final Pattern SLUG_PATH = Pattern.compile("^([a-z0-9]+(-[a-z0-9]+)*)?(/[a-z0-9]+(-[a-z0-9]+)*)*$");

  private final MarkdownChunker chunker = new MarkdownChunker(MAX);

  @Provide
  Arbitrary<String> markdownDocuments() {
    return Arbitraries.integers().between(1, 5).flatMap(this::sections);
  }

  private Arbitrary<String> sections(int count) {
    List<Arbitrary<String>> parts = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      parts.add(section());
    }
    return Combinators.combine(parts).as(list -> String.join("\n", list));
  }

  private Arbitrary<String> section() {
    return Combinators.combine(
            Arbitraries.of("##", "###"), heading(), paragraphs())
        .as((marker, title, body) -> marker + " " + title + "\n" + body + "\n");
  }

  private Arbitrary<String> heading() {
    return words(1, 4).map(list -> String.join(" ", list));
  }

  private Arbitrary<String> paragraphs() {
    Arbitrary<String> sentence =
        words(2, 8).map(list -> capitalize(String.join(" ", list)) + ".");
    Arbitrary<String> paragraph = sentence.list().ofMinSize(1).ofMaxSize(6).map(s -> String.join(" ", s));
    return paragraph.list().ofMinSize(1).ofMaxSize(4).map(p -> String.join("\n\n", p));
  }

  private Arbitrary<List<String>> words(int min, int max) {
    return Arbitraries.strings().withCharRange('a', 'z').ofMinLength(3).ofMaxLength(8)
        .list().ofMinSize(min).ofMaxSize(max);
  }

  private static String capitalize(String s) {
    return Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }

  @Property
  void noChunkIsBlank(@ForAll("markdownDocuments") String markdown) {
    assertThat(chunker.chunk(markdown)).allSatisfy(c -> assertThat(c.text()).isNotBlank());
  }

  @Property
  void chunksRespectSizeLimit(@ForAll("markdownDocuments") String markdown) {
    assertThat(chunker.chunk(markdown))
        .allSatisfy(c -> assertThat(c.text().length()).isLessThanOrEqualTo(MAX));
  }

  @Property
  void sectionPathsAreSlashSeparatedSlugs(@ForAll("markdownDocuments") String markdown) {
    assertThat(chunker.chunk(markdown))
        .allSatisfy(c -> assertThat(c.sectionPath()).matches(SLUG_PATH));
  }

  @Property
  void everyBodyWordSurvivesChunking(@ForAll("markdownDocuments") String markdown) {
    String joined =
        String.join(" ", chunker.chunk(markdown).stream().map(TextChunk::text).toList())
            .toLowerCase();
    Matcher words = WORD.matcher(markdown.toLowerCase());
    while (words.find()) {
      assertThat(joined).contains(words.group());
    }
  }
}
