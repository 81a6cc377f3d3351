package com.formproxy;

import com.formproxy.pagination.Paginator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PaginatorTest {
    private final Paginator paginator = new Paginator();

    @Test
    void slicesAndCountsPages() {
        List<Integer> items = List.of(1, 2, 3, 4, 5);

        var page = paginator.paginate(items, 0, 2);
        assertEquals(List.of(1, 2), page.items());
        assertEquals(5, page.totalResponses());
        assertEquals(3, page.pageCount());

        var last = paginator.paginate(items, 4, 2);
        assertEquals(List.of(5), last.items());
        assertEquals(3, last.pageCount());
    }

    @Test
    void offsetPastEndYieldsEmptyPage() {
        var page = paginator.paginate(List.of("a", "b"), 10, 150);
        assertTrue(page.items().isEmpty());
        assertEquals(2, page.totalResponses());
        assertEquals(1, page.pageCount());
    }

    @Test
    void emptyListHasNoPages() {
        var page = paginator.paginate(List.of(), 0, 150);
        assertEquals(0, page.totalResponses());
        assertEquals(0, page.pageCount());
    }

    @Test
    void pageSizeAndCountAgreeForEveryOffsetAndLimit() {
        for (int n = 0; n <= 12; n++) {
            List<Integer> items = IntStream.range(0, n).boxed().toList();
            for (int limit = 1; limit <= 5; limit++) {
                for (int offset = 0; offset <= n + 2; offset++) {
                    var page = paginator.paginate(items, offset, limit);
                    assertEquals((int) Math.ceil(n / (double) limit), page.pageCount());
                    assertEquals(Math.min(limit, Math.max(0, n - offset)), page.items().size());
                }
            }
        }
    }
}
