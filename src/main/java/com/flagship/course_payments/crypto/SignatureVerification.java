package com.flagship.course_payments.crypto;

/**
 * Outcome of a signature check. Callers branch on the variant instead of catching exceptions.
 */
public sealed interface SignatureVerification {

    boolean isVerified();

    static SignatureVerification verified() {
        return new Verified();
    }

    static SignatureVerification rejected(String reason) {
        return new Rejected(reason);
    }

    record Verified() implements SignatureVerification {
        @Override
        public boolean isVerified() {
            return true;
        }
    }

    record Rejected(String reason) implements SignatureVerification {
        @Override
        public boolean isVerified() {
            return false;
        }
    }
}
