package com.bsl.dimrank.profile;

public record ProfileMatch(Profile profile, double confidence, boolean detected) {}
