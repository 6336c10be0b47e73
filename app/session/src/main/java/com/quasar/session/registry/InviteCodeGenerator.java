/*
 * どこで: Session Registry
 * 何を: 非公開 Match 用の招待コードを生成する
 * なぜ: 乱数源を注入可能にし、コード形式（3 byte の大文字 hex）を 1 か所で固定するため
 */
package com.quasar.session.registry;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.HexFormat;
import java.util.Locale;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Component;

@Component
public class InviteCodeGenerator {

  static final int CODE_BYTES = 3;

  private static final HexFormat HEX = HexFormat.of().withUpperCase();

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RandomGenerator は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RandomGenerator random;

  public InviteCodeGenerator(RandomGenerator random) {
    this.random = random;
  }

  public String generate() {
    final byte[] bytes = new byte[CODE_BYTES];
    random.nextBytes(bytes);
    return HEX.formatHex(bytes);
  }

  /** 照合用の正規形。保存時・検索時の両方で使う。 */
  public static String normalize(String code) {
    return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
  }
}
