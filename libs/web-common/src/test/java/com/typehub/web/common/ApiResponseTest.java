package com.typehub.web.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    @Test
    @DisplayName("成功响应携带数据且 isSuccess 为 true")
    void successCarriesData() {
        ApiResponse<String> r = ApiResponse.success("ABC123");

        assertThat(r.code()).isEqualTo(200);
        assertThat(r.data()).isEqualTo("ABC123");
        assertThat(r.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("冲突响应使用 409 且不带数据")
    void conflictHasNoData() {
        ApiResponse<Object> r = ApiResponse.conflict("比赛已开始");

        assertThat(r.code()).isEqualTo(409);
        assertThat(r.message()).isEqualTo("比赛已开始");
        assertThat(r.data()).isNull();
        assertThat(r.isSuccess()).isFalse();
    }
}
