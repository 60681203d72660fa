package com.bsl.dimrank.index;

public record CandidateHit(String chunkId, double similarity) {}
