/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.internal.codec;

import java.util.List;

import org.slf4j.Logger;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import io.netty.util.ReferenceCountUtil;

/**
 * Abstraction for decoders that turn one inbound message into at most one decoded message.
 * Subclasses describe the result as a {@link DecodeOutcome}.
 */
abstract class KafkaMessageDecoder extends MessageToMessageDecoder<Object> {

    protected abstract Logger log();

    protected abstract DecodeOutcome decodeMessage(ChannelHandlerContext ctx, Object msg);

    @Override
    protected void decode(ChannelHandlerContext ctx, Object msg, List<Object> out) {
        DecodeOutcome outcome = decodeMessage(ctx, msg);
        if (outcome instanceof DecodeOutcome.Emit emit) {
            Object message = emit.message();
            if (message == msg) {
                // the inbound message is released once decode returns
                ReferenceCountUtil.retain(msg);
            }
            out.add(message);
        }
        else if (outcome instanceof DecodeOutcome.Failed failed) {
            log().error("{}: Error in decoder", ctx, failed.cause());
            throw failed.cause();
        }
    }
}
