package com.ai.jobmatch.dto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SearchVariationTest {

    @Test
    void enumParsingIsLenient() {
        assertThat(LocationType.parse("Departement")).isEqualTo(LocationType.DEPARTMENT);
        assertThat(LocationType.parse(null)).isEqualTo(LocationType.UNKNOWN);
        assertThat(ExperienceLevel.parse("senior").getCode()).isEqualTo("3");
        assertThat(ExperienceLevel.parse("2")).isEqualTo(ExperienceLevel.MID);
        assertThat(ExperienceLevel.NONE.getCode()).isEqualTo("1");
        assertThat(ExperienceRequirement.parse("E")).isEqualTo(ExperienceRequirement.REQUIRED);
        assertThat(ExperienceRequirement.parse("desired").getCode()).isEqualTo("S");
        assertThat(ExperienceRequirement.parse("whatever")).isNull();
    }

    @Test
    void fallbackCarriesOnlyKeywords() {
        SearchVariation fallback = SearchVariation.fallback("data analyst");

        assertThat(fallback.getKeywords()).isEqualTo("data analyst");
        assertThat(fallback.hasLocation()).isFalse();
        assertThat(fallback.toFilters()).isEqualTo(JobSearchFilters.NONE);
    }
}
