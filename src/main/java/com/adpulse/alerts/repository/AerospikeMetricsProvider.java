package com.adpulse.alerts.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.BatchPolicy;
import com.adpulse.alerts.config.AerospikeConfig;
import com.adpulse.alerts.config.AlertEngineConfig;
import com.adpulse.alerts.exception.ProviderException;
import com.adpulse.alerts.model.MetricsSnapshot;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the per-day campaign metrics written by the ads sync job and aggregates them into
 * the snapshots the detectors work on.
 *
 * Daily records are keyed {@code <campaignId>:<yyyyMMdd>}. Sums are taken for volume metrics;
 * impression-share losses are averaged over the days that report them. "Today" is the calendar
 * day in {@code alerts.schedule.zone}, the same day the analysis passes as month-to-date {@code asOf}.
 */
@Repository
public class AerospikeMetricsProvider implements MetricsProvider {

    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.BASIC_ISO_DATE;

    // How far back getCurrent looks for the latest synced day.
    private static final int CURRENT_SEARCH_DAYS = 7;

    private final AerospikeClient client;
    private final String namespace;
    private final BatchPolicy batchPolicy;
    private final Clock clock;
    private final AlertEngineConfig config;

    public AerospikeMetricsProvider(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    Clock clock,
                                    AlertEngineConfig config) {
        this.client = client;
        this.namespace = namespace;
        this.clock = clock;
        this.config = config;
        this.batchPolicy = new BatchPolicy();
        this.batchPolicy.totalTimeout = 3000;
        this.batchPolicy.socketTimeout = 1000;
    }

    @Override
    public MetricsSnapshot getCurrent(String campaignId) {
        LocalDate today = today();
        LocalDate from = today.minusDays(CURRENT_SEARCH_DAYS - 1);
        List<DailyMetrics> days = loadDays(campaignId, from, today);

        if (days.isEmpty()) {
            return MetricsSnapshot.empty();
        }
        DailyMetrics latest = days.get(days.size() - 1);
        return aggregate(List.of(latest), latest.date().toString());
    }

    @Override
    public MetricsSnapshot getPrevious(String campaignId, int lookbackDays) {
        LocalDate today = today();
        LocalDate from = today.minusDays(2L * lookbackDays);
        LocalDate to = today.minusDays(lookbackDays);
        return aggregate(loadDays(campaignId, from, to), from + ".." + to);
    }

    @Override
    public List<MetricsSnapshot> getWeekly(String campaignId, int weeks) {
        LocalDate today = today();
        List<MetricsSnapshot> result = new ArrayList<>();

        for (int i = 0; i < weeks; i++) {
            LocalDate to = today.minusDays(7L * i);
            LocalDate from = to.minusDays(6);
            List<DailyMetrics> days = loadDays(campaignId, from, to);
            if (days.isEmpty()) {
                continue;
            }
            String label = from.get(IsoFields.WEEK_BASED_YEAR) + "-W"
                    + String.format("%02d", from.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            result.add(aggregate(days, label));
        }
        return result;
    }

    @Override
    public MetricsSnapshot getMonthToDate(String campaignId, LocalDate asOf) {
        LocalDate from = asOf.withDayOfMonth(1);
        return aggregate(loadDays(campaignId, from, asOf), from + ".." + asOf);
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneId.of(config.getSchedule().getZone())));
    }

    /**
     * Existing daily records in {@code [from, to]}, oldest first.
     */
    private List<DailyMetrics> loadDays(String campaignId, LocalDate from, LocalDate to) {
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            dates.add(d);
        }
        if (dates.isEmpty()) {
            return List.of();
        }

        Key[] keys = new Key[dates.size()];
        for (int i = 0; i < dates.size(); i++) {
            keys[i] = new Key(namespace, AerospikeConfig.SET_DAILY_METRICS,
                    campaignId + ":" + dates.get(i).format(DAY_KEY));
        }

        Record[] records;
        try {
            records = client.get(batchPolicy, keys);
        } catch (AerospikeException e) {
            throw new ProviderException("Failed to load daily metrics for campaign " + campaignId, e);
        }

        List<DailyMetrics> days = new ArrayList<>();
        for (int i = 0; i < records.length; i++) {
            if (records[i] != null) {
                days.add(mapRecord(dates.get(i), records[i]));
            }
        }
        return days;
    }

    private DailyMetrics mapRecord(LocalDate date, Record record) {
        return new DailyMetrics(
                date,
                record.getLong("impressions"),
                record.getLong("clicks"),
                record.getDouble("cost"),
                record.getDouble("conversions"),
                record.getDouble("convValue"),
                optionalDouble(record, "lostIsBudget"),
                optionalDouble(record, "lostIsRank"));
    }

    private static Double optionalDouble(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    static MetricsSnapshot aggregate(List<DailyMetrics> days, String period) {
        if (days.isEmpty()) {
            return MetricsSnapshot.builder().period(period).build();
        }

        long impressions = 0;
        long clicks = 0;
        double cost = 0;
        double conversions = 0;
        double conversionValue = 0;
        double budgetLossSum = 0;
        int budgetLossDays = 0;
        double rankLossSum = 0;
        int rankLossDays = 0;

        for (DailyMetrics day : days) {
            impressions += day.impressions();
            clicks += day.clicks();
            cost += day.cost();
            conversions += day.conversions();
            conversionValue += day.conversionValue();
            if (day.lostIsBudget() != null) {
                budgetLossSum += day.lostIsBudget();
                budgetLossDays++;
            }
            if (day.lostIsRank() != null) {
                rankLossSum += day.lostIsRank();
                rankLossDays++;
            }
        }

        return MetricsSnapshot.builder()
                .impressions(impressions)
                .clicks(clicks)
                .cost(cost)
                .conversions(conversions)
                .conversionValue(conversionValue)
                .lostImpressionShareBudget(budgetLossDays > 0 ? budgetLossSum / budgetLossDays : null)
                .lostImpressionShareRank(rankLossDays > 0 ? rankLossSum / rankLossDays : null)
                .period(period)
                .build();
    }

    record DailyMetrics(LocalDate date, long impressions, long clicks, double cost, double conversions,
                        double conversionValue, Double lostIsBudget, Double lostIsRank) {
    }
}
