package com.flamingo.imagelab.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * A {@link Pageable} addressed by row offset and limit rather than page number, so that offsets
 * need not be multiples of the limit.
 */
public final class OffsetLimitPageable implements Pageable {

  private final long offset;
  private final int limit;
  private final Sort sort;

  private OffsetLimitPageable(long offset, int limit, Sort sort) {
    if (offset < 0) {
      throw new IllegalArgumentException("Offset must not be negative");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("Limit must be at least 1");
    }
    this.offset = offset;
    this.limit = limit;
    this.sort = sort;
  }

  public static OffsetLimitPageable of(long offset, int limit) {
    return new OffsetLimitPageable(offset, limit, Sort.unsorted());
  }

  public static OffsetLimitPageable of(long offset, int limit, Sort sort) {
    return new OffsetLimitPageable(offset, limit, sort);
  }

  @Override
  public int getPageNumber() {
    return (int) (offset / limit);
  }

  @Override
  public int getPageSize() {
    return limit;
  }

  @Override
  public long getOffset() {
    return offset;
  }

  @Override
  public Sort getSort() {
    return sort;
  }

  @Override
  public Pageable next() {
    return new OffsetLimitPageable(offset + limit, limit, sort);
  }

  @Override
  public Pageable previousOrFirst() {
    return hasPrevious()
        ? new OffsetLimitPageable(Math.max(0, offset - limit), limit, sort)
        : first();
  }

  @Override
  public Pageable first() {
    return new OffsetLimitPageable(0, limit, sort);
  }

  @Override
  public Pageable withPage(int pageNumber) {
    return new OffsetLimitPageable((long) pageNumber * limit, limit, sort);
  }

  @Override
  public boolean hasPrevious() {
    return offset > 0;
  }
}
