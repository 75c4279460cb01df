package com.spending.fraud.detection.rules;

import com.spending.fraud.alert.AlertEvidence;
import com.spending.fraud.alert.AlertRequest;
import com.spending.fraud.alert.AlertSeverity;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityKind;
import com.spending.fraud.core.model.RelationType;
import com.spending.fraud.core.model.RelationshipEdge;
import com.spending.fraud.detection.DetectionContext;
import com.spending.fraud.detection.DetectionRule;
import com.spending.fraud.matching.CandidatePair;
import com.spending.fraud.matching.MatchingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cross-references state employees with paid vendors, by name and by address.
 */
public class EmployeeVendorRule implements DetectionRule {
    private static final Logger log = LoggerFactory.getLogger(EmployeeVendorRule.class);

    public static final String NAME = "employee_vendor";

    static final double ADDRESS_CONFIDENCE = 0.85;

    public record NameMatchEvidence(
            long employeeId,
            String employeeName,
            String employeeAgency,
            String employeeTitle,
            Double employeeSalary,
            long vendorId,
            String vendorName,
            String vendorAddress,
            double nameSimilarity,
            long paymentCount,
            double totalPayments
    ) implements AlertEvidence {
    }

    public record AddressMatchEvidence(
            long employeeId,
            String employeeName,
            String employeeAgency,
            long vendorId,
            String vendorName,
            String sharedAddress,
            long paymentCount,
            double totalPayments
    ) implements AlertEvidence {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String displayName() {
        return "Employee-Vendor Match";
    }

    @Override
    public int detect(DetectionContext context) {
        List<CanonicalEntity> employees = context.data().employees();
        List<CanonicalEntity> vendors = context.data().vendors();
        double threshold = context.thresholds().getDouble("employee_vendor_name_similarity", 0.90);
        log.info("employee_vendor.start employees={} vendors={} threshold={}",
                employees.size(), vendors.size(), threshold);
        return detectNameMatches(context, employees, vendors, threshold)
                + detectAddressMatches(context, employees, vendors);
    }

    int detectNameMatches(DetectionContext context, List<CanonicalEntity> employees,
                          List<CanonicalEntity> vendors, double threshold) {
        MatchingResult result = context.matchingEngine().match(employees, vendors, context.matchingOptions(threshold));
        Map<Long, CanonicalEntity> employeeIndex = RuleSupport.byId(employees);
        Map<Long, CanonicalEntity> vendorIndex = RuleSupport.byId(vendors);

        context.relationshipMatcher().record(result.pairs(), RelationType.NAME, pair -> {
            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("employee_name", RuleSupport.nameOf(employeeIndex, pair.first().id(), pair.first().toString()));
            evidence.put("vendor_name", RuleSupport.nameOf(vendorIndex, pair.second().id(), pair.second().toString()));
            evidence.put("similarity", pair.score());
            return evidence;
        });

        int alerts = 0;
        for (CandidatePair pair : result.pairs()) {
            CanonicalEntity employee = employeeIndex.get(pair.first().id());
            CanonicalEntity vendor = vendorIndex.get(pair.second().id());
            double paid = context.vendorPaymentTotal(pair.second().id());
            if (employee == null || vendor == null || paid <= 0.0) {
                continue;
            }
            long count = context.vendorPaymentCount(vendor.getId());
            double confidence = pair.score();
            String agency = employee.stringAttribute(CanonicalEntity.ATTR_AGENCY_NAME);
            String title = employee.stringAttribute(CanonicalEntity.ATTR_JOB_TITLE);
            double salary = employee.numericAttribute(CanonicalEntity.ATTR_ANNUAL_SALARY, Double.NaN);

            NameMatchEvidence evidence = new NameMatchEvidence(employee.getId(), employee.label(), agency, title,
                    Double.isNaN(salary) ? null : salary, vendor.getId(), vendor.label(),
                    vendor.stringAttribute(CanonicalEntity.ATTR_ADDRESS), confidence, count, paid);
            String description = String.format(Locale.US,
                    "Employee '%s' (%s at %s) has a %s name match with vendor '%s', which received %d payments "
                            + "totalling %s.",
                    employee.label(), title != null ? title : "Unknown", agency != null ? agency : "Unknown",
                    RuleSupport.percent(confidence), vendor.label(), count, RuleSupport.money(paid));
            alerts += context.raise(new AlertRequest("employee_vendor_match", nameMatchSeverity(confidence, paid),
                    "Employee-vendor name match: " + employee.label(), description,
                    EntityKind.EMPLOYEE, employee.getId(), evidence));
        }
        return alerts;
    }

    static AlertSeverity nameMatchSeverity(double confidence, double totalPayments) {
        if ((confidence >= 0.95 && totalPayments >= 100_000) || confidence >= 0.98) {
            return AlertSeverity.HIGH;
        }
        return AlertSeverity.MEDIUM;
    }

    int detectAddressMatches(DetectionContext context, List<CanonicalEntity> employees, List<CanonicalEntity> vendors) {
        Map<String, List<CanonicalEntity>> vendorsByAddress = new TreeMap<>();
        for (CanonicalEntity vendor : vendors) {
            if (vendor.hasNormalizedAddress()) {
                vendorsByAddress.computeIfAbsent(vendor.getNormalizedAddress(), k -> new ArrayList<>()).add(vendor);
            }
        }

        List<CanonicalEntity> sortedEmployees = new ArrayList<>(employees);
        sortedEmployees.sort(Comparator.comparingLong(CanonicalEntity::getId));
        int alerts = 0;
        for (CanonicalEntity employee : sortedEmployees) {
            if (!employee.hasNormalizedAddress()) {
                continue;
            }
            String address = employee.getNormalizedAddress();
            for (CanonicalEntity vendor : vendorsByAddress.getOrDefault(address, List.of())) {
                Map<String, Object> edgeEvidence = new LinkedHashMap<>();
                edgeEvidence.put("address", address);
                edgeEvidence.put("employee_name", employee.label());
                edgeEvidence.put("vendor_name", vendor.label());
                context.store().upsert(new RelationshipEdge(employee.ref(), vendor.ref(), RelationType.ADDRESS,
                        ADDRESS_CONFIDENCE, edgeEvidence));

                double paid = context.vendorPaymentTotal(vendor.getId());
                if (paid <= 0.0) {
                    continue;
                }
                long count = context.vendorPaymentCount(vendor.getId());
                String agency = employee.stringAttribute(CanonicalEntity.ATTR_AGENCY_NAME);
                String description = String.format(Locale.US,
                        "Employee '%s' shares the address '%s' with vendor '%s', which received %d payments "
                                + "totalling %s.",
                        employee.label(), address, vendor.label(), count, RuleSupport.money(paid));
                alerts += context.raise(new AlertRequest("employee_vendor_address_match", AlertSeverity.HIGH,
                        "Employee-vendor address match: " + employee.label(), description,
                        EntityKind.EMPLOYEE, employee.getId(),
                        new AddressMatchEvidence(employee.getId(), employee.label(), agency, vendor.getId(),
                                vendor.label(), address, count, paid)));
            }
        }
        return alerts;
    }
}
