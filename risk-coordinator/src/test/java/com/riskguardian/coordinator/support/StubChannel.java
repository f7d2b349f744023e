package com.riskguardian.coordinator.support;

import com.riskguardian.analysis.channel.AnalyzerCall;
import com.riskguardian.analysis.channel.AnalyzerChannel;
import com.riskguardian.analysis.channel.AnalyzerReply;
import com.riskguardian.common.exception.AnalyzerException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/** Scripted {@link AnalyzerChannel}; records every call it receives. */
public class StubChannel<T> implements AnalyzerChannel<T> {

    private final String name;
    private final Function<AnalyzerCall, Mono<AnalyzerReply<T>>> behaviour;
    private final List<AnalyzerCall> calls = Collections.synchronizedList(new ArrayList<>());

    public StubChannel(String name, Function<AnalyzerCall, Mono<AnalyzerReply<T>>> behaviour) {
        this.name = name;
        this.behaviour = behaviour;
    }

    public static <T> StubChannel<T> replying(String name, T result) {
        return new StubChannel<>(name, call -> Mono.just(
            new AnalyzerReply<>(call.correlationId(), result, "stub://" + name, 5L)));
    }

    public static <T> StubChannel<T> silent(String name) {
        return new StubChannel<>(name, call -> Mono.never());
    }

    public static <T> StubChannel<T> failing(String name, String message) {
        return new StubChannel<>(name, call -> Mono.error(new AnalyzerException(name, message)));
    }

    @Override
    public Mono<AnalyzerReply<T>> request(AnalyzerCall call) {
        return Mono.defer(() -> {
            calls.add(call);
            return behaviour.apply(call);
        });
    }

    @Override
    public String analyzerName() {
        return name;
    }

    public List<AnalyzerCall> calls() {
        return List.copyOf(calls);
    }
}
