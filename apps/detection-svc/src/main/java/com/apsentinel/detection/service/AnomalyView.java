package com.apsentinel.detection.service;

import com.apsentinel.detection.model.Anomaly;

/**
 * Anomaly joined with the vendor name and bill number of the bill it references.
 */
public record AnomalyView(Anomaly anomaly, String vendorName, String billNumber) {
}
