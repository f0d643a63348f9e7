package com.flamingo.dozor.domain;

/**
 * Rectangle of detector pixels excluded from spot search ({@code ix_min .. iy_max} in the command
 * file).
 */
public record BadRegion(int ixMin, int ixMax, int iyMin, int iyMax) {}
