package com.meltwater.rabbitdriver;

import org.junit.Test;

import java.io.IOException;

import static com.meltwater.rabbitdriver.InterruptionPolicy.DEFAULT;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class InterruptionPolicyTest {

    @Test
    public void failures_without_detail_are_benign() {
        assertTrue(DEFAULT.isBenign(WaitFailure.withoutDetail()));
        assertTrue(DEFAULT.isBenign(new WaitFailure("", null)));
    }

    @Test
    public void thread_interrupts_are_benign() {
        assertTrue(DEFAULT.isBenign(WaitFailure.interrupted(new InterruptedException())));
    }

    @Test
    public void interrupted_system_call_is_matched_ignoring_case() {
        assertTrue(DEFAULT.isBenign(new WaitFailure("stream_select(): unable to select [4]: Interrupted system call", null)));
        assertTrue(DEFAULT.isBenign(new WaitFailure("INTERRUPTED SYSTEM CALL", new IOException())));
    }

    @Test
    public void everything_else_is_fatal() {
        assertFalse(DEFAULT.isBenign(new WaitFailure("Connection reset by peer", null)));
        assertFalse(DEFAULT.isBenign(new WaitFailure(null, new IOException("broken pipe"))));
    }
}
