package bulkmail.support;

import bulkmail.ReportGenerator;
import bulkmail.model.Campaign;
import bulkmail.model.DeliveryLog;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

public class RecordingReportGenerator implements ReportGenerator {
  public final List<Campaign> campaigns = new CopyOnWriteArrayList<>();
  public final List<List<DeliveryLog>> logs = new CopyOnWriteArrayList<>();
  public final CountDownLatch generated = new CountDownLatch(1);

  @Override
  public void generate(Campaign campaign, List<DeliveryLog> logs) {
    this.campaigns.add(campaign);
    this.logs.add(logs);
    generated.countDown();
  }
}
