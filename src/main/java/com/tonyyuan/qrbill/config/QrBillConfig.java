package com.tonyyuan.qrbill.config;

import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the QR-bill beans ({@code QrBillService}, {@code SwissPaymentCodeSerializer}).
 * Host applications pull them in with {@code @Import(QrBillConfig.class)}.
 */
@Configuration
@ComponentScan(basePackages = "com.tonyyuan.qrbill.service")
public class QrBillConfig {
}
