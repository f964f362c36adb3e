package com.slb.crowdfund_backend.modules.campaign.domain;

import org.springframework.util.StringUtils;

/**
 * Unit a campaign is denominated in. Chosen once at initialization; only the transport
 * adapter looks at which variant it is.
 */
public interface Denomination {

    String NATIVE_KEY = "NATIVE";

    /**
     * Key used by custody books and audit rows, e.g. {@code NATIVE} or {@code EXTERNAL:usdc}.
     */
    String key();

    static Denomination nativeUnit() {
        return Native.INSTANCE;
    }

    static Denomination external(String reference) {
        return new ExternalFungible(reference);
    }

    /**
     * @param kind      NATIVE | EXTERNAL (blank means NATIVE)
     * @param reference token reference, required for EXTERNAL
     */
    static Denomination of(String kind, String reference) {
        if (!StringUtils.hasText(kind) || NATIVE_KEY.equalsIgnoreCase(kind.trim())) {
            return nativeUnit();
        }
        if ("EXTERNAL".equalsIgnoreCase(kind.trim())) {
            return external(reference);
        }
        throw new IllegalArgumentException("unknown denomination kind: " + kind);
    }

    record Native() implements Denomination {
        static final Native INSTANCE = new Native();

        @Override
        public String key() {
            return NATIVE_KEY;
        }
    }

    record ExternalFungible(String reference) implements Denomination {
        public ExternalFungible {
            if (!StringUtils.hasText(reference)) {
                throw new IllegalArgumentException("token reference must not be blank");
            }
            reference = reference.trim();
        }

        @Override
        public String key() {
            return "EXTERNAL:" + reference;
        }
    }
}
