package com.chaininsights.validator.uptime;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * One up/down observation of a miner in one round. Rows are append-only; the
 * {@code (hotkey, round_id)} unique key keeps a miner to a single row per round.
 */
@Data
@NoArgsConstructor
@Table("miner_uptime_observation")
public class MinerUptimeObservation {

    @Id
    private Long id;

    private String hotkey;

    private int uid;

    @Column("is_up")
    private boolean up;

    private String roundId;

    private Instant observedAt;
}
