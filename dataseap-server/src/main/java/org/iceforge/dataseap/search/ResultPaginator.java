package org.iceforge.dataseap.search;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Client-side page window over the merged hit list.
 */
@Component
public class ResultPaginator {

    private final SearchProperties props;

    public ResultPaginator(SearchProperties props) {
        this.props = Objects.requireNonNull(props);
    }

    public SearchModels.SearchResult paginate(List<SearchModels.SearchHit> hits, SearchModels.Pagination pagination) {
        int page = page(pagination);
        int size = pageSize(pagination);
        long total = hits.size();
        int totalPages = (int) ((total + size - 1) / size);
        return new SearchModels.SearchResult(slice(hits, page, size), total,
                new SearchModels.PageInfo(page, size, total, totalPages));
    }

    int page(SearchModels.Pagination p) {
        if (p == null || p.page() == null || p.page() < 1) {
            return 1;
        }
        return p.page();
    }

    int pageSize(SearchModels.Pagination p) {
        if (p == null || p.pageSize() == null || p.pageSize() < 1) {
            return props.getDefaultPageSize();
        }
        return Math.min(p.pageSize(), props.getMaxPageSize());
    }

    static <T> List<T> slice(List<T> items, int page, int size) {
        long start = (long) (page - 1) * size;
        if (start >= items.size()) {
            return List.of();
        }
        int end = (int) Math.min(items.size(), start + size);
        return List.copyOf(items.subList((int) start, end));
    }
}
