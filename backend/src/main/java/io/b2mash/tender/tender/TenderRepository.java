package io.b2mash.tender.tender;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongFunction;
import org.springframework.stereotype.Repository;

/**
 * Append-only tender store keyed by id. Ids start at 1 and are allocated without gaps; tenders are
 * never removed.
 */
@Repository
public class TenderRepository {

  private final Map<Long, Tender> tenders = new ConcurrentHashMap<>();
  private long lastId;

  /**
   * Allocates the next id, builds the tender with {@code factory} and stores it. Allocation and
   * insertion are one step, so a tender with id n is visible only after ids 1..n-1 are.
   */
  public synchronized Tender create(LongFunction<Tender> factory) {
    long id = lastId + 1;
    Tender tender = factory.apply(id);
    if (tender.getId() != id) {
      throw new IllegalStateException("factory must use the allocated id " + id);
    }
    tenders.put(id, tender);
    lastId = id;
    return tender;
  }

  public Optional<Tender> findById(long id) {
    return Optional.ofNullable(tenders.get(id));
  }

  /** All tenders ordered by id. */
  public List<Tender> findAll() {
    return tenders.values().stream().sorted(Comparator.comparingLong(Tender::getId)).toList();
  }

  public long count() {
    return tenders.size();
  }
}
