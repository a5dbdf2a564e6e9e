package com.newsharvest.core.util;

import java.time.Duration;

/**
 * 요청 간격/재시도 대기의 단일 통로.
 * 운영은 {@link #THREAD}, 테스트는 호출만 기록하는 람다를 넣는다.
 */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    /** 실제로 현재 스레드를 재운다. 0 이하는 즉시 반환. */
    Sleeper THREAD = d -> {
        long ms = (d == null) ? 0 : d.toMillis();
        if (ms > 0) Thread.sleep(ms);
    };

    /** 기다리지 않음 */
    Sleeper NONE = d -> {};
}
