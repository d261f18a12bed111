package com.bloodbridge.common.dto;

import com.bloodbridge.common.util.Paging;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageResponseTest {

    @Test
    void from_usesOneBasedPagesAndMapsItems() {
        PageImpl<Integer> page = new PageImpl<>(List.of(4, 5, 6), PageRequest.of(1, 3), 10);

        PageResponse<String> response = PageResponse.from(page, String::valueOf);

        assertThat(response.data()).containsExactly("4", "5", "6");
        assertThat(response.pagination()).isEqualTo(new PageResponse.Pagination(2, 3, 10, 4, true, true));
    }

    @Test
    void paging_clampsPageAndLimit() {
        assertThat(Paging.of(null, null, Sort.unsorted())).isEqualTo(PageRequest.of(0, 10));
        assertThat(Paging.of(0, 500, Sort.unsorted())).isEqualTo(PageRequest.of(0, 100));
        assertThat(Paging.of(3, 25, Sort.unsorted())).isEqualTo(PageRequest.of(2, 25));
    }
}
