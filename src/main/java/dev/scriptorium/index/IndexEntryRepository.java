package dev.scriptorium.index;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for reading {@link IndexEntry} rows. */
public interface IndexEntryRepository extends JpaRepository<IndexEntry, UUID> {

  /**
   * Finds an entry by id, scoped to the owning account.
   *
   * @param id the embedding id
   * @param account the account the entry must belong to
   * @return the entry, or empty if it does not exist or belongs to another account
   */
  @Query(
      value =
          """
            SELECT * FROM index_entries
            WHERE embedding_id = :id AND metadata->>'account' = :account
            """,
      nativeQuery = true)
  Optional<IndexEntry> findByIdAndAccount(@Param("id") UUID id, @Param("account") String account);

  /**
   * Counts entries per account.
   *
   * @param account the account
   * @return number of stored entries
   */
  @Query(
      value = "SELECT COUNT(*) FROM index_entries WHERE metadata->>'account' = :account",
      nativeQuery = true)
  long countByAccount(@Param("account") String account);
}
