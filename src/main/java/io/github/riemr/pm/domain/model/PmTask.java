package io.github.riemr.pm.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * 定期保守（PM）作業1件。取り込み済み・正規化済みの入力として扱い、スケジューラは読み取りのみ行う。
 */
@Value
@Builder(toBuilder = true)
public class PmTask {
    String description;
    String system;
    /** 0 の作業は容量を消費せず、割当対象外 */
    int durationMinutes;
    /** 並び順にのみ使用（1回の計画内で繰り返し展開はしない） */
    int intervalMonths;
    String category;
    String referencePage;
}
