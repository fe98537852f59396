package com.yerin.bgworker.config;

import com.yerin.bgworker.domain.CompletedAction;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PgWorkerConfig {

    /** Action for a message whose job succeeded. Defaults to {@link CompletedAction#DELETE}. */
    private CompletedAction successAction;

    /** Action for a message that failed and has no retries left. Defaults to {@link CompletedAction#ARCHIVE}. */
    private CompletedAction failureAction;
}
