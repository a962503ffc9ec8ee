package mta.eda.receipts.service.scheduler;

import mta.eda.receipts.model.receipt.GenerateOptions;
import mta.eda.receipts.model.schedule.TimingConfig;
import mta.eda.receipts.service.status.StatusSink;
import org.springframework.stereotype.Component;

/**
 * Builds schedulers that report into the shared status tracker with the configured
 * default timing and receipt options. Each scheduler owns its own runs.
 */
@Component
public class DeliverySchedulerFactory {

    private final StatusSink statusSink;
    private final TimingConfig defaultTiming;
    private final GenerateOptions generateOptions;

    public DeliverySchedulerFactory(StatusSink statusSink, TimingConfig defaultTiming, GenerateOptions generateOptions) {
        this.statusSink = statusSink;
        this.defaultTiming = defaultTiming;
        this.generateOptions = generateOptions;
    }

    public DeliveryScheduler create(ReceiptGenerator receiptGenerator) {
        return new DeliveryScheduler(receiptGenerator, statusSink, defaultTiming, generateOptions);
    }
}
