package ca.gc.cra.prism.infrastructure.source;

import ca.gc.cra.prism.application.json.JsonSupport;
import ca.gc.cra.prism.domain.chain.TransactionRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses an upstream block transaction listing.
 *
 * <p>Accepts a bare JSON array or an object wrapping the array in {@code data}. Fees may be numbers or numeric
 * strings; unparseable or negative fees count as zero. Shielded indicators are read leniently: booleans,
 * numbers and arrays are all accepted.</p>
 *
 * @since PRISM 0.1
 */
public final class TransactionJsonParser {
  private static final Logger log = LoggerFactory.getLogger(TransactionJsonParser.class);

  private final JsonSupport json = new JsonSupport();

  /**
   * Parses one page.
   *
   * @param body response body
   * @param blockHeight height of the block the page belongs to
   * @return records in upstream order
   * @throws IllegalArgumentException if the body is not a transaction listing
   */
  public List<TransactionRecord> parse(byte[] body, long blockHeight) {
    Object root = json.parse(body);
    if (root instanceof Map<?, ?> map) {
      Object data = map.get("data");
      root = data == null ? List.of() : data;
    }
    List<Object> items = JsonSupport.asArray("transactions", root);
    List<TransactionRecord> records = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      Map<String, Object> tx = JsonSupport.asObject("transactions[" + i + "]", items.get(i));
      records.add(toRecord(tx, blockHeight, i));
    }
    return records;
  }

  private TransactionRecord toRecord(Map<String, Object> tx, long blockHeight, int index) {
    String txId = JsonSupport.optString(tx, "hash")
        .or(() -> JsonSupport.optString(tx, "id"))
        .orElse(blockHeight + ":" + index);
    boolean flag = truthy(tx.get("is_shielded")) || truthy(tx.get("shielded_spend"));
    return new TransactionRecord(
        txId,
        blockHeight,
        fee(tx.get("fee"), txId),
        flag,
        count(tx.get("shielded_spend_count")),
        count(tx.get("shielded_output_count")),
        count(tx.get("joinsplit")));
  }

  private static double fee(Object raw, String txId) {
    double fee;
    if (raw instanceof Number number) {
      fee = number.doubleValue();
    } else if (raw instanceof String text) {
      try {
        fee = Double.parseDouble(text.trim());
      } catch (NumberFormatException ex) {
        log.debug("Unparseable fee '{}' on {}; counting as zero", text, txId);
        return 0.0;
      }
    } else {
      return 0.0;
    }
    if (!Double.isFinite(fee) || fee < 0) {
      log.debug("Invalid fee {} on {}; counting as zero", fee, txId);
      return 0.0;
    }
    return fee;
  }

  private static boolean truthy(Object raw) {
    if (raw instanceof Boolean bool) {
      return bool;
    }
    if (raw instanceof Number number) {
      return number.doubleValue() != 0;
    }
    if (raw instanceof String text) {
      return !text.isBlank() && !text.equals("0") && !text.equalsIgnoreCase("false");
    }
    if (raw instanceof Collection<?> collection) {
      return !collection.isEmpty();
    }
    return raw instanceof Map<?, ?>;
  }

  private static int count(Object raw) {
    if (raw instanceof Number number) {
      return (int) Math.max(0, Math.min(Integer.MAX_VALUE, number.longValue()));
    }
    if (raw instanceof Collection<?> collection) {
      return collection.size();
    }
    return truthy(raw) ? 1 : 0;
  }
}
