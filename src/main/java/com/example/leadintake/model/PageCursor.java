package com.example.leadintake.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Position of a bulk sync run. Either a page number or an opaque next link
 * drives the following request; {@code exhausted} means no page remains.
 */
@Data
@AllArgsConstructor
public class PageCursor {
    private int page;
    private int perPage;
    private String nextLink;
    private Long totalCount;
    private boolean exhausted;

    public static PageCursor first(int perPage) {
        return new PageCursor(1, perPage, null, null, false);
    }

    public static PageCursor followLink(PageCursor current, String nextLink, Long totalCount) {
        return new PageCursor(current.getPage() + 1, current.getPerPage(), nextLink, totalCount, false);
    }

    public static PageCursor nextPage(PageCursor current, int page, Long totalCount) {
        return new PageCursor(page, current.getPerPage(), null, totalCount, false);
    }

    public static PageCursor end(PageCursor current, Long totalCount) {
        return new PageCursor(current.getPage(), current.getPerPage(), null, totalCount, true);
    }
}
