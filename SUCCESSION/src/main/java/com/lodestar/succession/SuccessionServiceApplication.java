package com.lodestar.succession;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * SUCCESSION - Leadership Pipeline Engine for the LODESTAR platform.
 *
 * <p>SUCCESSION provides:
 * <ul>
 *   <li>Eligibility - Criteria evaluation over member activity snapshots</li>
 *   <li>Candidacy intake - Nominations, self-applications and secondments</li>
 *   <li>Evaluation - Weighted rubric scoring with conflict-of-interest recusal</li>
 *   <li>Interviews and voting - Panel feedback, committee ballots and quorum</li>
 *   <li>Lifecycle - Guarded stage transitions with deadline automation</li>
 * </ul>
 *
 * <p>SUCCESSION integrates with:
 * <ul>
 *   <li>Member data service - Tenure, events and leadership history via HTTP</li>
 *   <li>Notification service - Template dispatch via Kafka</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class SuccessionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SuccessionServiceApplication.class, args);
    }
}
