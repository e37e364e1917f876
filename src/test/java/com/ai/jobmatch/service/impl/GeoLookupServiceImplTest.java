package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.config.GeoApiConfig;
import com.ai.jobmatch.dto.GeoPlace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GeoLookupServiceImplTest {

    private MockRestServiceServer server;
    private GeoLookupServiceImpl service;

    @BeforeEach
    void setUp() {
        GeoApiConfig config = new GeoApiConfig();
        RestClient.Builder builder = RestClient.builder().baseUrl("https://geo.example.test");
        server = MockRestServiceServer.bindTo(builder).build();
        service = new GeoLookupServiceImpl(builder.build(), config);
    }

    @Test
    void citySearchByNameBoostsPopulation() {
        server.expect(requestTo(startsWith("https://geo.example.test/communes")))
                .andExpect(queryParam("nom", "Lyon"))
                .andExpect(queryParam("boost", "population"))
                .andExpect(queryParam("limit", "10"))
                .andRespond(withSuccess("""
                        [{"nom":"Lyon","code":"69123","codesPostaux":["69001","69002"],
                          "departement":{"code":"69","nom":"Rhône"},
                          "region":{"code":"84","nom":"Auvergne-Rhône-Alpes"}}]
                        """, MediaType.APPLICATION_JSON));

        List<GeoPlace> cities = service.searchCities("Lyon");

        assertThat(cities).hasSize(1);
        GeoPlace lyon = cities.get(0);
        assertThat(lyon.getCode()).isEqualTo("69123");
        assertThat(lyon.getPostalCodes()).contains("69001");
        assertThat(lyon.parentDepartmentCode()).isEqualTo("69");
        assertThat(lyon.getRegion().getName()).isEqualTo("Auvergne-Rhône-Alpes");
        server.verify();
    }

    @Test
    void fiveDigitInputIsAPostalCodeQuery() {
        server.expect(requestTo(startsWith("https://geo.example.test/communes")))
                .andExpect(queryParam("codePostal", "33000"))
                .andRespond(withSuccess("[{\"nom\":\"Bordeaux\",\"code\":\"33063\"}]", MediaType.APPLICATION_JSON));

        assertThat(service.searchCities("33000")).extracting(GeoPlace::getName).containsExactly("Bordeaux");
        server.verify();
    }

    @Test
    void shortInputIsNotSent() {
        assertThat(service.searchCities("L")).isEmpty();
        assertThat(service.searchCities("  ")).isEmpty();
        server.verify();
    }

    @Test
    void departmentCodeQueriesByCode() {
        server.expect(requestTo(startsWith("https://geo.example.test/departements")))
                .andExpect(queryParam("code", "2A"))
                .andRespond(withSuccess("[{\"nom\":\"Corse-du-Sud\",\"code\":\"2A\",\"codeRegion\":\"94\"}]",
                        MediaType.APPLICATION_JSON));

        List<GeoPlace> departments = service.searchDepartments("2a");

        assertThat(departments).extracting(GeoPlace::getCode).containsExactly("2A");
        assertThat(departments.get(0).getRegionCode()).isEqualTo("94");
        server.verify();
    }

    @Test
    void httpFailureReturnsEmpty() {
        server.expect(requestTo(startsWith("https://geo.example.test/regions"))).andRespond(withServerError());

        assertThat(service.searchRegions("Bretagne")).isEmpty();
        server.verify();
    }
}
