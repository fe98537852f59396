package com.yerin.bgworker.config;

import com.yerin.bgworker.domain.StaleCleanupBehavior;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PeriodicProperties {
    private boolean enable = true;
    private StaleCleanupBehavior staleCleanup = StaleCleanupBehavior.AUTO_CLEAN_STALE;
}
