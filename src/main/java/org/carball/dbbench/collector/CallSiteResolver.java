package org.carball.dbbench.collector;

import org.carball.dbbench.model.query.CallSite;
import org.carball.dbbench.model.query.StackFrame;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Attributes a query to the nearest application frame of the stack that issued it.
 * Frames from the JDK, data-access frameworks and this library are skipped; when nothing
 * qualifies the first frame from an application source root is used instead.
 */
public class CallSiteResolver {

    public static final List<String> DEFAULT_SKIPPED_PACKAGES = List.of(
            "java.",
            "javax.",
            "jdk.",
            "sun.",
            "com.sun.",
            "org.springframework.",
            "org.hibernate.",
            "org.apache.ibatis.",
            "org.jooq.",
            "com.zaxxer.hikari.",
            "org.junit.",
            "org.carball.dbbench."
    );

    public static final List<String> DEFAULT_SOURCE_ROOTS = List.of(
            "/src/main/",
            "/src/test/"
    );

    // Constructors and reflective dispatch
    private static final Set<String> SKIPPED_METHODS = Set.of(
            "<init>", "<clinit>", "invoke", "invoke0", "proceed", "toString", "hashCode", "equals"
    );

    private final List<String> skippedPackages;
    private final List<String> sourceRoots;

    public CallSiteResolver() {
        this(DEFAULT_SKIPPED_PACKAGES, DEFAULT_SOURCE_ROOTS);
    }

    public CallSiteResolver(List<String> skippedPackages, List<String> sourceRoots) {
        this.skippedPackages = List.copyOf(skippedPackages);
        this.sourceRoots = List.copyOf(sourceRoots);
    }

    public CallSite resolve(List<StackFrame> frames) {
        if (frames == null || frames.isEmpty()) {
            return CallSite.unknown();
        }

        for (StackFrame frame : frames) {
            if (isApplicationFrame(frame)) {
                return CallSite.of(frame);
            }
        }

        for (StackFrame frame : frames) {
            if (frame.file() != null && isUnderSourceRoot(frame.file())) {
                return CallSite.of(frame);
            }
        }

        return CallSite.unknown();
    }

    /**
     * Resolves the call site of the current thread, for workloads that report queries
     * without capturing frames themselves.
     */
    public CallSite resolveCurrentThread() {
        StackTraceElement[] stack = Thread.currentThread().getStackTrace();
        return resolve(Arrays.stream(stack).map(StackFrame::of).toList());
    }

    private boolean isApplicationFrame(StackFrame frame) {
        if (frame.file() == null) {
            return false;
        }
        if (frame.file().contains("/vendor/") || frame.file().contains("/.m2/repository/")) {
            return false;
        }
        if (frame.method() != null && (SKIPPED_METHODS.contains(frame.method()) || frame.method().startsWith("access$"))) {
            return false;
        }
        if (frame.className() != null) {
            for (String prefix : skippedPackages) {
                if (frame.className().startsWith(prefix)) {
                    return false;
                }
            }
            if (frame.className().contains("$$")) {
                // Generated proxy classes (CGLIB, ByteBuddy)
                return false;
            }
        }
        return true;
    }

    private boolean isUnderSourceRoot(String file) {
        String normalized = file.replace('\\', '/');
        return sourceRoots.stream().anyMatch(normalized::contains);
    }
}
