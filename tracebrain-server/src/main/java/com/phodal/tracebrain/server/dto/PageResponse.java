package com.phodal.tracebrain.server.dto;

import com.phodal.tracebrain.store.Page;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One window of a listing plus the size of the full result.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {

    private List<T> items;

    private long total;

    private int skip;

    private int limit;

    public static <T> PageResponse<T> of(Page<T> page) {
        return new PageResponse<>(page.items(), page.total(), page.skip(), page.limit());
    }
}
