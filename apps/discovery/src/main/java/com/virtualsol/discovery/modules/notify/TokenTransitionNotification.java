package com.virtualsol.discovery.modules.notify;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound message telling one user that a watched token changed lifecycle state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenTransitionNotification {

    private String userId;
    private String mint;
    private String oldState;
    private String newState;
    private String title;
    private String message;
    private String actionUrl;
    private long createdAt;
}
