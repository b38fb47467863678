package com.dingdangmaoup.dock.repository;

import com.dingdangmaoup.dock.exception.ErrorCode;
import com.dingdangmaoup.dock.exception.RegistryException;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * {@code n}/{@code last} paging over a sorted list of names.
 */
public final class Pagination {

    private Pagination() {
    }

    public static Page apply(List<String> sortedNames, Integer limit, String last) {
        if (limit != null && limit < 0) {
            throw new RegistryException(ErrorCode.PAGINATION_NUMBER_INVALID,
                    "n must not be negative", Map.of("n", limit));
        }
        List<String> remaining = last == null || last.isEmpty()
                ? sortedNames
                : sortedNames.stream().filter(name -> name.compareTo(last) > 0).toList();
        if (limit == null || remaining.size() <= limit) {
            return new Page(remaining, false);
        }
        return new Page(remaining.subList(0, limit), true);
    }

    @Data
    @AllArgsConstructor
    public static class Page {
        private List<String> items;
        private boolean hasMore;

        public String lastItem() {
            return items.isEmpty() ? null : items.get(items.size() - 1);
        }
    }
}
