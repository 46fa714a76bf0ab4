package com.acme.strmatch.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Score of one candidate against one query.
 *
 * @param candidateId      identifier of the candidate profile
 * @param clr              combined likelihood-ratio proxy, always strictly positive
 * @param posterior        {@code clr / (clr + 1)}, flat 50/50 prior
 * @param consistentLoci   loci sharing at least one allele
 * @param mutatedLoci      loci explained by a single-step mutation
 * @param inconclusiveLoci loci with missing data on either side
 */
public record MatchResult(
        @JsonProperty("person_id")         String candidateId,
        @JsonProperty("clr")               double clr,
        @JsonProperty("posterior")         double posterior,
        @JsonProperty("consistent_loci")   int consistentLoci,
        @JsonProperty("mutated_loci")      int mutatedLoci,
        @JsonProperty("inconclusive_loci") int inconclusiveLoci
) {}
