package com.rankcup.competition.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Competition limits, creation throttling and the season calendar.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "rankcup.competition")
public class CompetitionProperties {

    /**
     * Active (not cancelled, not ended) competitions one owner may hold per server.
     */
    private int ownerLimit = 1;

    /**
     * Active competitions allowed per server across all owners.
     */
    private int serverLimit = 2;

    /**
     * Owners exempt from both the owner and server limits.
     */
    private Set<String> privilegedOwnerIds = new LinkedHashSet<>();

    private int defaultMaxParticipants = 50;
    private int minParticipants = 2;
    private int maxParticipants = 100;
    private int maxDurationDays = 90;

    /**
     * Window after a successful creation during which the same (server, user) is reported as rate limited.
     */
    private Duration creationRateLimit = Duration.ofHours(1);

    private BulkEnrollment bulkEnrollment = new BulkEnrollment();
    private List<Season> seasons = new ArrayList<>();

    @Getter
    @Setter
    public static class BulkEnrollment {
        private int parallelism = 8;
        private int queueCapacity = 1_000;
    }

    @Getter
    @Setter
    public static class Season {
        private String id;
        private String displayName;

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
        private OffsetDateTime startDate;

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
        private OffsetDateTime endDate;
    }
}
