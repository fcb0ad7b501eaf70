package io.doublezero.globalmonitor.application.plan;

import io.doublezero.globalmonitor.domain.dz.User;
import io.doublezero.globalmonitor.domain.net.GeoIpRecord;
import io.doublezero.globalmonitor.domain.net.Ipv4;
import io.doublezero.globalmonitor.domain.net.Source;
import io.doublezero.globalmonitor.domain.probe.MeasurementPoint;
import io.doublezero.globalmonitor.domain.probe.ProbePath;
import io.doublezero.globalmonitor.domain.probe.ProbeResult;
import io.doublezero.globalmonitor.domain.probe.ProbeStats;
import io.doublezero.globalmonitor.domain.probe.ProbeType;
import java.net.InetAddress;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Builds measurement points using the shared tag and field vocabulary.
 */
final class PointBuilder {
  private final String table;
  private final Map<String, String> tags = new LinkedHashMap<>();
  private final Map<String, Object> fields = new LinkedHashMap<>();

  PointBuilder(String table, ProbeType probeType) {
    this.table = table;
    tags.put("probe_type", probeType.label());
  }

  PointBuilder tag(String key, String value) {
    if (value != null) {
      tags.put(key, value);
    }
    return this;
  }

  PointBuilder field(String key, Object value) {
    if (value != null) {
      fields.put(key, value);
    }
    return this;
  }

  PointBuilder source(Source source) {
    return tag("source_metro", source.metro())
        .tag("source_metro_name", source.metroName())
        .tag("source_host", source.host());
  }

  PointBuilder sourceDevice(User sourceUser) {
    if (sourceUser != null && sourceUser.device() != null) {
      tag("source_dzd_code", sourceUser.deviceCode());
      tag("source_dzd_metro_code", sourceUser.exchangeCode());
      tag("source_dzd_metro_name", sourceUser.exchangeName());
    }
    return this;
  }

  PointBuilder targetDevice(User targetUser) {
    if (targetUser != null) {
      tag("target_dzd_code", targetUser.deviceCode());
      tag("target_dzd_metro_code", targetUser.exchangeCode());
      tag("target_dzd_metro_name", targetUser.exchangeName());
    }
    return this;
  }

  PointBuilder targetIp(InetAddress ip) {
    return tag("target_ip", Ipv4.text(ip)).tag("target_ip_block_24", Ipv4.block24(ip));
  }

  /**
   * Tags the path and source address for the interface.
   *
   * @return the path, or empty when the interface is neither source interface
   */
  Optional<ProbePath> path(Source source, String iface) {
    if (source.isOverlayIface(iface)) {
      InetAddress dzIp = source.dzIp() != null ? source.dzIp() : source.user() == null ? null : source.user().dzIp();
      tag("probe_path", ProbePath.DOUBLEZERO.label());
      tag("source_iface", source.dzIface());
      tag("source_ip", dzIp == null ? "" : Ipv4.text(dzIp));
      return Optional.of(ProbePath.DOUBLEZERO);
    }
    if (source.publicIface().equals(iface)) {
      tag("probe_path", ProbePath.PUBLIC_INTERNET.label());
      tag("source_iface", source.publicIface());
      tag("source_ip", Ipv4.text(source.publicIp()));
      return Optional.of(ProbePath.PUBLIC_INTERNET);
    }
    return Optional.empty();
  }

  PointBuilder geoIp(GeoIpRecord geo) {
    if (geo == null) {
      return this;
    }
    tag("target_geoip_country", geo.country());
    tag("target_geoip_country_code", geo.countryCode());
    tag("target_geoip_region", geo.region());
    tag("target_geoip_city", geo.city());
    tag("target_geoip_city_id", Integer.toString(geo.cityId()));
    tag("target_geoip_metro", geo.metroName());
    tag("target_geoip_asn", Long.toString(geo.asn()));
    tag("target_geoip_asn_org", geo.asnOrg());
    field("target_geoip_latitude", geo.latitude());
    field("target_geoip_longitude", geo.longitude());
    return this;
  }

  /**
   * Adds outcome fields and builds the point.
   *
   * @return empty for not-ready results and for successes without stats
   */
  Optional<MeasurementPoint> outcome(ProbeResult result, Logger log, String subject) {
    if (result.notReady()) {
      return Optional.empty();
    }
    if (!result.ok()) {
      field("probe_ok", false);
      field("probe_fail_reason", result.failReason().label());
      return Optional.of(build(result));
    }
    ProbeStats stats = result.stats();
    if (stats == null) {
      log.error("Stats missing on successful result for {}", subject);
      return Optional.empty();
    }
    field("probe_ok", true);
    field("probe_rtt_avg_ms", millis(stats.rttAvg()));
    field("probe_rtt_latest_ms", millis(stats.rttAvg()));
    field("probe_rtt_min_ms", millis(stats.rttMin()));
    field("probe_rtt_dev_ms", millis(stats.rttStdDev()));
    field("probe_packets_sent", stats.packetsSent());
    field("probe_packets_recv", stats.packetsReceived());
    field("probe_packets_lost", stats.packetsLost());
    field("probe_loss_ratio", stats.lossRatio());
    return Optional.of(build(result));
  }

  private MeasurementPoint build(ProbeResult result) {
    return new MeasurementPoint(table, tags, fields, result.timestamp());
  }

  private static double millis(Duration duration) {
    return (double) duration.toMillis();
  }
}
