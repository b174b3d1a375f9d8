package it.unimib.datai.podman.common.errors;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NotFoundExceptionTest {

    @ParameterizedTest
    @ValueSource(ints = {400, 404, 410, 499, 500, 502, 599})
    void bothVariantsAreApiErrorsForAnyErrorStatus(int status) {
        ApiResponse response = mock(ApiResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.reason()).thenReturn("Reason");

        ApiException notFound = new NotFoundException("missing", response);
        ApiException imageNotFound = new ImageNotFoundException("missing", response);

        assertThat(notFound).isInstanceOf(ApiException.class);
        assertThat(imageNotFound).isInstanceOf(ApiException.class);
        assertThat(notFound.isError()).isTrue();
        assertThat(imageNotFound.isError()).isTrue();
    }

    @Test
    void kindsDistinguishTheVariants() {
        assertThat(new NotFoundException("x").kind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(new ImageNotFoundException("x").kind()).isEqualTo(ErrorKind.IMAGE_NOT_FOUND);
        assertThat(new ImageNotFoundException("x")).isNotInstanceOf(NotFoundException.class);
    }

    @Test
    void rendersLikeApiException() {
        ApiResponse response = mock(ApiResponse.class);
        when(response.statusCode()).thenReturn(404);
        when(response.reason()).thenReturn("Not Found");

        ImageNotFoundException ex = new ImageNotFoundException("no such image", response, "quay.io/x/y:1");

        assertThat(ex.getMessage()).isEqualTo("404 Client Error: Not Found (quay.io/x/y:1)");
    }
}
