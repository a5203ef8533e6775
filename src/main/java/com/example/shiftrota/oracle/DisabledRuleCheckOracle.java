package com.example.shiftrota.oracle;

import com.example.shiftrota.schedule.Schedule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "rotation.oracle.enabled", havingValue = "false", matchIfMissing = true)
public class DisabledRuleCheckOracle implements RuleCheckOracle {

    @Override
    public OracleReport check(Schedule schedule, String rulesText) {
        return OracleReport.unavailable("disabled");
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
