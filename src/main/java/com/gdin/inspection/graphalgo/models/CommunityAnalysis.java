package com.gdin.inspection.graphalgo.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Jacksonized
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommunityAnalysis {

    @JsonProperty("num_communities")
    Integer numCommunities;

    /** 社区编号 -> 成员数，按编号升序 */
    @JsonProperty("community_sizes")
    Map<Integer, Integer> communitySizes;

    @JsonProperty("largest_community")
    Integer largestCommunity;

    @JsonProperty("smallest_community")
    Integer smallestCommunity;

    @JsonProperty("average_community_size")
    Double averageCommunitySize;

    /** 无法计算时为 null */
    @JsonProperty("modularity")
    Double modularity;

    @JsonProperty("error")
    String error;

    public static CommunityAnalysis error(String message) {
        return CommunityAnalysis.builder().error(message).build();
    }
}
