package com.lusta.gateway.ws;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 连接级入站串行队列：同一个 channel 上的任务按提交顺序一个接一个执行，
 * 前一个任务返回的 stage 完成后才开始下一个。任务本身在 channel 的 eventLoop 上启动。
 *
 * <p>前一个任务失败不影响后续任务；失败只体现在该任务自己的返回 future 上。</p>
 */
public final class WsChannelSerialQueue {

    private static final AttributeKey<Lane> ATTR_LANE = AttributeKey.valueOf("im:ws:inbound_lane");

    private static final class Lane {
        private final AtomicReference<CompletableFuture<Void>> tail =
                new AtomicReference<>(CompletableFuture.completedFuture(null));
        private final AtomicInteger pending = new AtomicInteger();
    }

    private WsChannelSerialQueue() {
    }

    /**
     * 积压（已提交未完成）达到 maxPending 时不入队，返回以 {@link RejectedExecutionException} 失败的 future。
     */
    public static CompletableFuture<Void> submit(Channel channel, Supplier<? extends CompletionStage<?>> task, int maxPending) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(task, "task");
        Lane lane = lane(channel);
        if (lane.pending.get() >= Math.max(1, maxPending)) {
            return CompletableFuture.failedFuture(new RejectedExecutionException("ws inbound queue full"));
        }

        lane.pending.incrementAndGet();
        CompletableFuture<Void> next = new CompletableFuture<>();
        CompletableFuture<Void> prev = lane.tail.getAndSet(next.handle((v, e) -> null));
        prev.whenComplete((v, e) -> runOnEventLoop(channel, task, next));
        next.whenComplete((v, e) -> lane.pending.decrementAndGet());
        return next;
    }

    public static int pending(Channel channel) {
        return lane(channel).pending.get();
    }

    private static void runOnEventLoop(Channel channel, Supplier<? extends CompletionStage<?>> task, CompletableFuture<Void> out) {
        if (channel.eventLoop().inEventLoop()) {
            start(task, out);
            return;
        }
        try {
            channel.eventLoop().execute(() -> start(task, out));
        } catch (RejectedExecutionException e) {
            // eventLoop 已关闭
            out.completeExceptionally(e);
        }
    }

    private static void start(Supplier<? extends CompletionStage<?>> task, CompletableFuture<Void> out) {
        CompletionStage<?> stage;
        try {
            stage = task.get();
        } catch (Throwable t) {
            out.completeExceptionally(t);
            return;
        }
        if (stage == null) {
            out.complete(null);
            return;
        }
        stage.whenComplete((v, e) -> {
            if (e != null) {
                out.completeExceptionally(e);
            } else {
                out.complete(null);
            }
        });
    }

    private static Lane lane(Channel channel) {
        Lane existing = channel.attr(ATTR_LANE).get();
        if (existing != null) {
            return existing;
        }
        Lane created = new Lane();
        Lane raced = channel.attr(ATTR_LANE).setIfAbsent(created);
        return raced == null ? created : raced;
    }
}
