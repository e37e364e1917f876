package com.ai.jobmatch.service.impl;

import com.ai.jobmatch.config.FranceTravailConfig;
import com.ai.jobmatch.dto.ExperienceLevel;
import com.ai.jobmatch.dto.ExperienceRequirement;
import com.ai.jobmatch.dto.JobSearchFilters;
import com.ai.jobmatch.dto.LocationConstraint;
import com.ai.jobmatch.entity.JobPosting;
import com.ai.jobmatch.exception.ExternalAuthException;
import com.ai.jobmatch.exception.ExternalSearchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class FranceTravailServiceImplTest {

    private static final String TOKEN_URL = "https://auth.example.test/token";
    private static final String SEARCH_URL = "https://api.example.test/partenaire/offresdemploi/v2/offres/search";
    private static final String TOKEN_JSON = "{\"access_token\":\"tok-1\",\"expires_in\":1499,\"token_type\":\"Bearer\"}";

    private MockRestServiceServer server;
    private FranceTravailServiceImpl service;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        FranceTravailConfig config = new FranceTravailConfig();
        config.setClientId("client");
        config.setClientSecret("secret");
        config.setTokenUrl(TOKEN_URL);
        config.setBaseUrl("https://api.example.test");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        service = new FranceTravailServiceImpl(builder.build(), config, clock);
    }

    @Test
    void parisCommuneIsSentAsDepartment75() {
        expectToken();
        server.expect(once(), requestTo(startsWith(SEARCH_URL)))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer tok-1"))
                .andExpect(queryParam("departement", "75"))
                .andExpect(queryParam("range", "0-49"))
                .andRespond(withSuccess("{\"resultats\":[{\"id\":\"1\",\"intitule\":\"Dev\"}]}", MediaType.APPLICATION_JSON));

        List<JobPosting> jobs = service.searchJobs("developpeur", LocationConstraint.commune("75056"), JobSearchFilters.NONE);

        assertThat(jobs).extracting(JobPosting::getId).containsExactly("1");
        server.verify();
    }

    @Test
    void communeIsSentWithDefaultRadius() {
        URI uri = service.buildSearchUri("python", LocationConstraint.commune("69123"), JobSearchFilters.NONE);

        Map<String, List<String>> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        assertThat(params.get("commune")).containsExactly("69123");
        assertThat(params.get("distance")).containsExactly("25");
        assertThat(params).doesNotContainKey("departement");
    }

    @Test
    void twoDigitCodeIsSentAsDepartment() {
        URI uri = service.buildSearchUri("python", LocationConstraint.commune("33"), JobSearchFilters.NONE);

        Map<String, List<String>> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        assertThat(params.get("departement")).containsExactly("33");
        assertThat(params).doesNotContainKeys("commune", "distance");
    }

    @Test
    void filtersAreTranslatedToSourceCodes() {
        JobSearchFilters filters = JobSearchFilters.builder()
                .experienceLevel(ExperienceLevel.JUNIOR)
                .experienceRequirement(ExperienceRequirement.BEGINNER_OK)
                .contractType("CDI")
                .fullTime(true)
                .publishedWithinDays(7)
                .build();

        URI uri = service.buildSearchUri("data", LocationConstraint.region("84"), filters);

        Map<String, List<String>> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        assertThat(params.get("region")).containsExactly("84");
        assertThat(params.get("experience")).containsExactly("1");
        assertThat(params.get("experienceExigence")).containsExactly("D");
        assertThat(params.get("typeContrat")).containsExactly("CDI");
        assertThat(params.get("tempsPlein")).containsExactly("true");
        assertThat(params.get("publieeDepuis")).containsExactly("7");
        assertThat(params).doesNotContainKeys("domaine", "sort");
    }

    @Test
    void noContentIsAnEmptyResult() {
        expectToken();
        server.expect(requestTo(startsWith(SEARCH_URL))).andRespond(withNoContent());

        assertThat(service.searchJobs("rare", LocationConstraint.national(), JobSearchFilters.NONE)).isEmpty();
    }

    @Test
    void serverErrorIsAHardFailure() {
        expectToken();
        server.expect(requestTo(startsWith(SEARCH_URL))).andRespond(withServerError());

        assertThatThrownBy(() -> service.searchJobs("java", LocationConstraint.national(), JobSearchFilters.NONE))
                .isInstanceOf(ExternalSearchException.class)
                .satisfies(e -> assertThat(((ExternalSearchException) e).getStatusCode()).isEqualTo(500));
    }

    @Test
    void tokenIsReusedUntilRefreshMargin() {
        expectToken();
        assertThat(service.getAccessToken()).isEqualTo("tok-1");

        // 만료 60초 전까지는 캐시 사용
        clock.advance(Duration.ofSeconds(1400));
        assertThat(service.getAccessToken()).isEqualTo("tok-1");
        server.verify();

        server.reset();
        server.expect(once(), requestTo(TOKEN_URL))
                .andRespond(withSuccess("{\"access_token\":\"tok-2\",\"expires_in\":1499}", MediaType.APPLICATION_JSON));
        clock.advance(Duration.ofSeconds(40));
        assertThat(service.getAccessToken()).isEqualTo("tok-2");
        server.verify();
    }

    @Test
    void tokenFailureIsAnAuthError() {
        server.expect(requestTo(TOKEN_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> service.searchJobs("java", LocationConstraint.national(), JobSearchFilters.NONE))
                .isInstanceOf(ExternalAuthException.class);
    }

    private void expectToken() {
        server.expect(once(), requestTo(TOKEN_URL))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(TOKEN_JSON, MediaType.APPLICATION_JSON));
    }

    private static class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
