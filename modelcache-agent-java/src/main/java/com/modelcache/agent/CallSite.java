package com.modelcache.agent;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders a short human-readable call site from a captured call stack.
 *
 * The window is fixed: the innermost {@link #DISPATCH_FRAME_SKIP} frames belong to the
 * load dispatch path (see {@link ModelLoadTracker#afterLoad}), the next
 * {@link #MAX_CONTEXT_FRAMES} frames are the real caller plus context.
 *
 * Format: {@code file:line[, file:line[, file:line]]}
 */
public final class CallSite {

    /**
     * Frames between the real caller and the stack capture:
     * Thread.getStackTrace, captureStack, dispatch, afterLoad, the load method itself.
     * Must change together with the dispatch path.
     */
    public static final int DISPATCH_FRAME_SKIP = 5;

    public static final int MAX_CONTEXT_FRAMES = 3;

    static final String UNKNOWN = "unknown";

    private CallSite() {}

    /** One stack frame. {@code file} may be null; a null or non-positive {@code line} is unknown. */
    public record Frame(String file, Integer line) {

        String render() {
            String rendered = file != null ? file : UNKNOWN;
            if (line != null && line > 0) {
                rendered += ":" + line;
            }
            return rendered;
        }
    }

    public static String describe(List<Frame> stack) {
        if (stack == null || stack.size() <= DISPATCH_FRAME_SKIP) {
            return UNKNOWN;
        }
        int end = Math.min(stack.size(), DISPATCH_FRAME_SKIP + MAX_CONTEXT_FRAMES);
        StringJoiner joiner = new StringJoiner(", ");
        for (int i = DISPATCH_FRAME_SKIP; i < end; i++) {
            Frame frame = stack.get(i);
            joiner.add(frame != null ? frame.render() : UNKNOWN);
        }
        return joiner.toString();
    }

    /**
     * Converts JVM stack trace elements to frames.
     *
     * The file of a frame is the source path of its declaring class
     * ({@code com/example/Product.java}), resolved against {@code sourceRoot} when given.
     */
    public static List<Frame> fromStackTrace(StackTraceElement[] elements, Path sourceRoot) {
        List<Frame> frames = new ArrayList<>(elements.length);
        for (StackTraceElement element : elements) {
            frames.add(new Frame(sourcePath(element, sourceRoot), element.getLineNumber()));
        }
        return frames;
    }

    static String sourcePath(StackTraceElement element, Path sourceRoot) {
        String fileName = element.getFileName();
        if (fileName == null) return null;

        String className = element.getClassName();
        int lastDot = className.lastIndexOf('.');
        String relative = lastDot < 0
            ? fileName
            : className.substring(0, lastDot).replace('.', '/') + "/" + fileName;

        return sourceRoot != null ? sourceRoot.resolve(relative).toString() : relative;
    }
}
