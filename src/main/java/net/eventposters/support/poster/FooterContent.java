package net.eventposters.support.poster;

/**
 * Texts and QR target printed in the footer band.
 *
 * @param ctaText call to action above the link
 * @param linkText human-readable link
 * @param qrUrl URL encoded in the QR code
 */
public record FooterContent(String ctaText, String linkText, String qrUrl) {}
