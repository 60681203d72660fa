package com.bsl.dimrank.service;

public enum RankingState {
    INIT,
    PROFILE_RESOLVED,
    CANDIDATES_FETCHED,
    SCORED,
    RANKED,
    DONE,
    FALLBACK,
    TIMEOUT
}
