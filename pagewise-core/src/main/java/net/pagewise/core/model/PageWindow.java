package net.pagewise.core.model;

import net.pagewise.core.error.SchemaMismatchException;

/**
 * page/per_page 로만 읽을 수 있는 목록 API 위의 offset 커서.
 * <p>
 * 커서는 지금까지 읽은 아이템 수(절대 offset)다. 청크 크기가 중간에 바뀌어도 같은 위치를 가리킨다.
 * per_page 는 offset 을 나눠떨어지게 하는 값 중 pageSize 이하의 최댓값이라
 * (page - 1) * perPage == offset 이 항상 성립한다.
 */
public record PageWindow(long offset, int page, int perPage) {

    public static PageWindow at(String cursor, int pageSize) throws SchemaMismatchException {
        if (pageSize < 1) throw new IllegalArgumentException("pageSize must be >= 1: " + pageSize);
        long offset = parseOffset(cursor);
        if (offset == 0) return new PageWindow(0, 1, pageSize);

        int perPage = largestDivisorUpTo(offset, pageSize);
        long page = offset / perPage + 1;
        if (page > Integer.MAX_VALUE) {
            throw new SchemaMismatchException("offset cursor out of page range: " + cursor);
        }
        return new PageWindow(offset, (int) page, perPage);
    }

    /** returned 개를 읽은 뒤의 커서 */
    public String cursorAfter(int returned) {
        return String.valueOf(offset + returned);
    }

    /** rel="last" 페이지 번호로 전체 건수 상한 추정 */
    public long estimateTotal(int lastPage) {
        return (long) lastPage * perPage;
    }

    static long parseOffset(String cursor) throws SchemaMismatchException {
        if (cursor == null || cursor.isBlank()) return 0;
        try {
            long o = Long.parseLong(cursor.trim());
            if (o < 0) throw new SchemaMismatchException("offset cursor must not be negative: " + cursor);
            return o;
        } catch (NumberFormatException e) {
            throw new SchemaMismatchException("not an offset cursor: " + cursor, e);
        }
    }

    private static int largestDivisorUpTo(long offset, int limit) {
        for (int d = (int) Math.min(limit, offset); d > 1; d--) {
            if (offset % d == 0) return d;
        }
        return 1;
    }
}
