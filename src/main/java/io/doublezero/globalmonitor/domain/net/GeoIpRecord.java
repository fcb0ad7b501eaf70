package io.doublezero.globalmonitor.domain.net;

/**
 * GeoIP annotation for a target address.
 */
public record GeoIpRecord(
    String country,
    String countryCode,
    String region,
    String city,
    int cityId,
    String metroName,
    long asn,
    String asnOrg,
    double latitude,
    double longitude) {}
