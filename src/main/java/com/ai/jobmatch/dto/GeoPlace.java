package com.ai.jobmatch.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * geo.api.gouv.fr 응답 항목 (communes, departements, regions 공통)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeoPlace {

    @JsonProperty("nom")
    private String name;

    private String code;

    @JsonProperty("codesPostaux")
    private List<String> postalCodes = new ArrayList<>();

    @JsonProperty("departement")
    private GeoRef department;

    private GeoRef region;

    @JsonProperty("codeDepartement")
    private String departmentCode;

    @JsonProperty("codeRegion")
    private String regionCode;

    /**
     * 상위 데파르트망 코드. 중첩 객체가 없으면 codeDepartement 필드를 사용한다.
     */
    public String parentDepartmentCode() {
        if (department != null && department.getCode() != null) {
            return department.getCode();
        }
        return departmentCode;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GeoRef {
        private String code;
        @JsonProperty("nom")
        private String name;
    }
}
