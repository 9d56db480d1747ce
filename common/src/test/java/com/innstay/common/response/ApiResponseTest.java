package com.innstay.common.response;

import com.innstay.common.exception.BusinessException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ApiResponseTest {

    @Test
    void ok_withData_returnsSuccessResponse() {
        ApiResponse<String> response = ApiResponse.ok("IS-7K2M9Q");

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).isEqualTo("IS-7K2M9Q");
        assertThat(response.getError()).isNull();
    }

    @Test
    void ok_withoutData_returnsSuccessResponse() {
        ApiResponse<Void> response = ApiResponse.ok();

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).isNull();
        assertThat(response.getError()).isNull();
    }

    @Test
    void error_withErrorCode_returnsGenericAccessMessage() {
        ApiResponse<Void> response = ApiResponse.error(ErrorCode.ACCESS_DENIED);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getData()).isNull();
        assertThat(response.getError().getCode()).isEqualTo("A001");
        assertThat(response.getError().getMessage()).isEqualTo("Unable to process request. Please try again.");
    }

    @Test
    void error_withCustomMessage_returnsErrorResponse() {
        ApiResponse<Void> response = ApiResponse.error(ErrorCode.INVALID_INPUT, "bookingId is required");

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getError().getCode()).isEqualTo("C001");
        assertThat(response.getError().getMessage()).isEqualTo("bookingId is required");
    }

    @Test
    void error_fromBusinessException_carriesDetails() {
        BusinessException ex = new BusinessException(ErrorCode.PRICE_MISMATCH) {
            @Override
            public Map<String, Object> getDetails() {
                return Map.of("calculatedTotal", "2928.00");
            }
        };

        ApiResponse<Void> response = ApiResponse.error(ex);

        assertThat(response.getError().getCode()).isEqualTo("PRICE_MISMATCH");
        assertThat(response.getError().getDetails()).containsEntry("calculatedTotal", "2928.00");
    }

    @Test
    void error_plainBusinessException_hasNoDetails() {
        ApiResponse<Void> response = ApiResponse.error(new BusinessException(ErrorCode.ALREADY_PAID));

        assertThat(response.getError().getMessage()).isEqualTo("Booking is already paid");
        assertThat(response.getError().getDetails()).isEmpty();
    }
}
