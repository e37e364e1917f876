package com.ai.jobmatch.entity;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

/**
 * France Travail 채용공고. 식별자는 공고 출처가 부여한 id이며, 점수와 지원 여부는 검색 과정에서 직접 채워진다.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobPosting {

    private String id;

    @JsonAlias("intitule")
    private String title;

    private String description;

    private String companyName;

    private String location;

    private String communeCode;

    @JsonAlias("typeContrat")
    private String contractType;

    @JsonAlias("typeContratLibelle")
    private String contractLabel;

    @JsonAlias("dateCreation")
    private String publishedAt;

    private String url;

    // 검색 과정에서 추가되는 필드
    private Integer relevanceScore;

    private String relevanceReasoning;

    @JsonProperty("isApplied")
    private boolean applied;

    public JobPosting(String id, String title, String description) {
        this.id = id;
        this.title = title;
        this.description = description;
    }

    @JsonProperty("entreprise")
    private void unpackEmployer(Map<String, Object> entreprise) {
        if (entreprise != null && entreprise.get("nom") != null) {
            this.companyName = String.valueOf(entreprise.get("nom"));
        }
    }

    @JsonProperty("lieuTravail")
    private void unpackWorkplace(Map<String, Object> lieuTravail) {
        if (lieuTravail == null) {
            return;
        }
        if (lieuTravail.get("libelle") != null) {
            this.location = String.valueOf(lieuTravail.get("libelle"));
        }
        if (lieuTravail.get("commune") != null) {
            this.communeCode = String.valueOf(lieuTravail.get("commune"));
        }
    }

    @JsonProperty("origineOffre")
    private void unpackOrigin(Map<String, Object> origineOffre) {
        if (origineOffre != null && origineOffre.get("urlOrigine") != null) {
            this.url = String.valueOf(origineOffre.get("urlOrigine"));
        }
    }

    public void markRanked(int score, String reasoning) {
        this.relevanceScore = score;
        this.relevanceReasoning = reasoning;
    }
}
