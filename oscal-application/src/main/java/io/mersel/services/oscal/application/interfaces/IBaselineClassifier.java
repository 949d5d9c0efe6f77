package io.mersel.services.oscal.application.interfaces;

import io.mersel.services.oscal.application.enums.BaselineLevel;

/**
 * Belgenin {@code security-sensitivity-level} değerinden FedRAMP baseline seviyesini tespit eder.
 * <p>
 * Hiçbir durumda istisna fırlatmaz; tanınmayan, eksik veya ayrıştırılamayan
 * girdiler için {@link BaselineLevel#MODERATE} döner.
 */
public interface IBaselineClassifier {

    BaselineLevel detect(byte[] xmlContent);

    BaselineLevel detect(XmlNode root);
}
