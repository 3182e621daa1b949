package com.listenpulse.ingestor.writer;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Output key layout: {@code <prefix>/year=YYYY/month=MM/day=DD/spotify_plays_yyyyMMdd_HHmmss_SSS.json},
 * all derived from the fetch instant in UTC. A non-zero sequence number is appended
 * as {@code _<n>} when the plain key is already taken.
 */
public final class PartitionPaths {

    public static final String DEFAULT_PREFIX = "raw";

    private static final DateTimeFormatter PARTITION =
            DateTimeFormatter.ofPattern("'year='yyyy'/month='MM'/day='dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private PartitionPaths() {}

    public static String partition(Instant fetchedAt) {
        return PARTITION.format(fetchedAt);
    }

    public static String objectKey(String prefix, Instant fetchedAt) {
        return objectKey(prefix, fetchedAt, 0);
    }

    public static String objectKey(String prefix, Instant fetchedAt, int sequence) {
        String suffix = sequence > 0 ? "_" + sequence : "";
        return prefix + "/" + partition(fetchedAt) + "/spotify_plays_" + FILE_STAMP.format(fetchedAt) + suffix + ".json";
    }
}
