package com.mike.contactharvester.service;

import com.mike.contactharvester.config.HarvesterProperties;
import com.mike.contactharvester.dto.HarvestQuery;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryPlannerTest {

    private HarvesterProperties props;
    private QueryPlanner planner;

    @BeforeEach
    void setUp() {
        props = new HarvesterProperties();
        props.setKeywords(List.of("air charter", "cargo"));
        props.setQueryTemplates(List.of("\"{keyword}\" \"{country}\" email", "site:.{tld} \"{keyword}\""));
        props.setCountryTlds(Map.of("Kenya", "KE"));
        planner = new QueryPlanner(props);
    }

    @Test
    @DisplayName("explicit queries go to the default category, deduplicated, in order")
    void explicitQueries() {
        props.setQueries(List.of("jet charter dubai", " jet charter dubai ", "", "cargo airline"));

        assertEquals(List.of(HarvestQuery.of("jet charter dubai"), HarvestQuery.of("cargo airline")),
                planner.plan());
    }

    @Test
    @DisplayName("countries expand keywords x templates with the country's TLD")
    void countryExpansion() {
        props.setCountries(List.of("Kenya"));

        assertEquals(List.of(
                new HarvestQuery("\"air charter\" \"Kenya\" email", "Kenya"),
                new HarvestQuery("site:.ke \"air charter\"", "Kenya"),
                new HarvestQuery("\"cargo\" \"Kenya\" email", "Kenya"),
                new HarvestQuery("site:.ke \"cargo\"", "Kenya")), planner.plan());
    }

    @Test
    @DisplayName("unknown country falls back to .com")
    void unknownCountryTld() {
        props.setCountries(List.of("Atlantis"));

        assertTrue(planner.plan().stream().map(HarvestQuery::text).toList().contains("site:.com \"cargo\""));
        assertEquals("ke", planner.tldFor("kenya"));
    }

    @Test
    @DisplayName("each category is capped at maxQueriesPerBatch")
    void capPerCategory() {
        props.setMaxQueriesPerBatch(3);
        props.setQueries(List.of("q1", "q2", "q3", "q4"));
        props.setCountries(List.of("Kenya", "Atlantis"));

        List<HarvestQuery> plan = planner.plan();

        assertEquals(3, countIn(plan, HarvestQuery.DEFAULT_CATEGORY));
        assertEquals(3, countIn(plan, "Kenya"));
        assertEquals(3, countIn(plan, "Atlantis"));
    }

    private static long countIn(List<HarvestQuery> plan, String category) {
        return plan.stream().filter(q -> q.category().equals(category)).count();
    }

    @Test
    void nothingConfiguredYieldsEmptyPlan() {
        assertTrue(planner.plan().isEmpty());
    }
}
