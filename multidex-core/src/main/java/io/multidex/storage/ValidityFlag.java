package io.multidex.storage;

/**
 * Shared liveness flag of one record. The record owns it; every ref to the
 * record observes it. Starts valid and is cleared exactly once.
 */
final class ValidityFlag {

    /** Flag of refs bound to nothing. */
    static final ValidityFlag DETACHED = detached();

    private volatile boolean valid = true;

    boolean isValid() {
        return valid;
    }

    void invalidate() {
        valid = false;
    }

    private static ValidityFlag detached() {
        ValidityFlag flag = new ValidityFlag();
        flag.invalidate();
        return flag;
    }
}
