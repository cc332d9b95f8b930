package com.lendpool.support;

import com.lendpool.common.LendingError;
import com.lendpool.common.LendingException;
import org.assertj.core.api.ThrowableAssert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public final class LendingAssertions {

    private LendingAssertions() {
    }

    public static void assertFailsWith(LendingError expected, ThrowableAssert.ThrowingCallable call) {
        assertThatThrownBy(call)
                .isInstanceOf(LendingException.class)
                .satisfies(e -> assertThat(((LendingException) e).getError()).isEqualTo(expected));
    }
}
