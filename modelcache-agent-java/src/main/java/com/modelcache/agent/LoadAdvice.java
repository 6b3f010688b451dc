package com.modelcache.agent;

import net.bytebuddy.asm.Advice;
import net.bytebuddy.implementation.bytecode.assign.Assigner;

/**
 * ByteBuddy exit advice woven into entity load methods.
 *
 * Runs after a load returns normally and reports the declaring type plus the first
 * argument (the load key). The advice is inlined, so the load method itself is one
 * frame of the dispatch path counted by {@link CallSite#DISPATCH_FRAME_SKIP}.
 */
public class LoadAdvice {

    @Advice.OnMethodExit
    public static void afterLoad(
            @Advice.Origin("#t") String typeName,
            @Advice.Argument(value = 0, typing = Assigner.Typing.DYNAMIC) Object identifier) {
        ModelLoadTracker.afterLoad(typeName, String.valueOf(identifier));
    }
}
