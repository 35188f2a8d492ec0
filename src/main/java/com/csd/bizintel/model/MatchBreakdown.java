package com.csd.bizintel.model;

import lombok.Builder;
import lombok.Value;

/**
 * Sub-scores of a pairwise match, each in [0,1], and the weighted overall score in [0,100].
 */
@Value
@Builder
public class MatchBreakdown {
    double industry;
    double title;
    double bio;
    double network;
    double location;
    double overall;
}
