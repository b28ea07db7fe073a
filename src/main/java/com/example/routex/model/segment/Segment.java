package com.example.routex.model.segment;

import java.time.Duration;

/**
 * Audience descriptor of a broadcast. Serialized as a JSON object with a {@code type} field
 * (see {@code SegmentCodec}).
 */
public sealed interface Segment {

    String TAG_ALL_SUBSCRIBED = "all_subscribed";
    String TAG_NO_KEY = "no_key";
    String TAG_INACTIVE_FOR = "inactive_for";
    String TAG_DONORS = "donors";
    String TAG_CUSTOM_FILTER = "custom_filter";

    String tag();

    record AllSubscribed() implements Segment {
        @Override
        public String tag() {
            return TAG_ALL_SUBSCRIBED;
        }
    }

    record NoKey() implements Segment {
        @Override
        public String tag() {
            return TAG_NO_KEY;
        }
    }

    record InactiveFor(Duration inactivity) implements Segment {
        @Override
        public String tag() {
            return TAG_INACTIVE_FOR;
        }
    }

    record Donors() implements Segment {
        @Override
        public String tag() {
            return TAG_DONORS;
        }
    }

    /**
     * Raw SQL predicate over the {@code subscribers} table, supplied by an administrator.
     * Does not apply the subscribed-only rule.
     */
    record CustomFilter(String expression) implements Segment {
        @Override
        public String tag() {
            return TAG_CUSTOM_FILTER;
        }
    }

    /**
     * A tag nobody recognizes. Resolves like {@link AllSubscribed}, so a typo in a segment never
     * silently targets zero people.
     */
    record Unknown(String tag) implements Segment {
    }
}
