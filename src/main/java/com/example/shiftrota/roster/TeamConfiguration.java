package com.example.shiftrota.roster;

import java.util.Optional;

/**
 * Team-level scheduling settings. The template is kept as the raw stored code so that an
 * unrecognized value surfaces as a configuration error at generation time.
 */
public record TeamConfiguration(Long teamId, String name, String shiftTemplate, int peoplePerShift) {

    public Optional<ShiftTemplate> template() {
        return ShiftTemplate.fromCode(shiftTemplate);
    }

    public int requiredFixedStaff() {
        return template().map(t -> t.shiftCount() * peoplePerShift).orElse(0);
    }
}
