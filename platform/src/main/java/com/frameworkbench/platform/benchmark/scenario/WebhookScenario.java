package com.frameworkbench.platform.benchmark.scenario;

import com.frameworkbench.platform.benchmark.BenchmarkTypes.ScenarioKind;
import com.frameworkbench.platform.benchmark.BenchmarkTypes.Workload;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SplittableRandom;

import static com.frameworkbench.platform.observe.Log.*;

/**
 * Shopify order webhooks posted to /webhooks/shopify, signed the way Shopify signs them:
 * base64 of HMAC-SHA256 over the raw body, keyed with the shared webhook secret.
 */
public final class WebhookScenario implements Scenario {

    static final String PATH = "/webhooks/shopify";
    static final String SIGNATURE_HEADER = "X-Shopify-Hmac-Sha256";
    private static final String HMAC = "HmacSHA256";

    private final Workload workload;

    public WebhookScenario(Workload workload) {
        this.workload = workload;
        if (!workload.signsWebhooks()) {
            warn("No webhook secret configured (SHOPIFY_WEBHOOK_SECRET); webhooks are sent unsigned");
        }
    }

    @Override
    public ScenarioKind kind() {
        return ScenarioKind.WEBHOOK;
    }

    @Override
    public Session newSession(int workerIndex, SplittableRandom random) {
        return () -> {
            String body = RequestSpec.json(order(workerIndex, random));
            RequestSpec request = RequestSpec.postJson(PATH, body, RequestSpec.Expectation.API_ENVELOPE)
                    .withHeader("X-Shopify-Topic", "orders/create")
                    .withHeader("X-Shopify-Shop-Domain", "bench-shop.myshopify.com");
            return workload.signsWebhooks()
                    ? request.withHeader(SIGNATURE_HEADER, sign(workload.webhookSecret(), body))
                    : request;
        };
    }

    public static String sign(String secret, String body) {
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC));
            return Base64.getEncoder().encodeToString(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static Map<String, Object> order(int workerIndex, SplittableRandom random) {
        long orderId = 1_000_000L + random.nextInt(9_000_000);
        double price = Math.round(random.nextDouble(5.0, 250.0) * 100) / 100.0;
        int quantity = 1 + random.nextInt(3);

        var lineItem = new LinkedHashMap<String, Object>();
        lineItem.put("title", "Bench Item");
        lineItem.put("quantity", quantity);
        lineItem.put("price", String.format(Locale.ROOT, "%.2f", price));

        var order = new LinkedHashMap<String, Object>();
        order.put("id", orderId);
        order.put("email", "bench-" + workerIndex + "@example.com");
        order.put("total_price", String.format(Locale.ROOT, "%.2f", price * quantity));
        order.put("currency", "USD");
        order.put("financial_status", "paid");
        order.put("line_items", List.of(lineItem));
        return order;
    }
}
