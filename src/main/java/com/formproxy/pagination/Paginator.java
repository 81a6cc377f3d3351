package com.formproxy.pagination;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class Paginator {

    public <T> Page<T> paginate(List<T> items, int offset, int limit) {
        int total = items.size();
        int from = Math.min(offset, total);
        int to = (int) Math.min((long) offset + limit, total);
        int pageCount = total == 0 ? 0 : (total + limit - 1) / limit;
        return new Page<>(List.copyOf(items.subList(from, to)), total, pageCount);
    }

    public record Page<T>(List<T> items, int totalResponses, int pageCount) {}
}
