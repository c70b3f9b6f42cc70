package com.compass.web.service;

import com.compass.common.exception.UnauthorizedException;
import com.compass.web.config.AdminProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdminGuardTest {

    private static AdminGuard guardWithToken(String token) {
        AdminProperties properties = new AdminProperties();
        properties.setToken(token);
        return new AdminGuard(properties);
    }

    @Test
    void acceptsConfiguredToken() {
        assertThatCode(() -> guardWithToken("s3cret").verify("s3cret")).doesNotThrowAnyException();
    }

    @Test
    void rejectsWrongOrMissingToken() {
        AdminGuard guard = guardWithToken("s3cret");

        assertThatThrownBy(() -> guard.verify("s3cre")).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> guard.verify(null)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void unconfiguredTokenLocksAdminSurface() {
        AdminGuard guard = guardWithToken("");

        assertThatThrownBy(() -> guard.verify("")).isInstanceOf(UnauthorizedException.class);
    }
}
