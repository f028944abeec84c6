package com.codeheadsystems.locker.vault.password;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

import com.codeheadsystems.locker.crypto.common.RandomProvider;
import java.util.EnumSet;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PasswordGeneratorTest {

  @Mock private RandomProvider randomProvider;

  private final PasswordGenerator generator = new PasswordGenerator(new RandomProvider());

  @Test
  void generate_hasRequestedLength() {
    assertThat(generator.generate(1, EnumSet.allOf(CharacterClass.class))).hasSize(1);
    assertThat(generator.generate(64, EnumSet.allOf(CharacterClass.class))).hasSize(64);
  }

  @Test
  void generate_usesOnlyEnabledClasses() {
    String digits = generator.generate(200, EnumSet.of(CharacterClass.DIGITS));
    assertThat(digits).matches("[0-9]{200}");

    String letters = generator.generate(200, EnumSet.of(CharacterClass.UPPER, CharacterClass.LOWER));
    assertThat(letters).matches("[A-Za-z]{200}");

    String symbols = generator.generate(200, EnumSet.of(CharacterClass.SYMBOLS));
    for (char c : symbols.toCharArray()) {
      assertThat(CharacterClass.SYMBOLS.alphabet()).contains(String.valueOf(c));
    }
  }

  @Test
  void generate_excludeSimilar_dropsLookAlikes() {
    String password = generator.generate(500, EnumSet.allOf(CharacterClass.class), true);
    assertThat(password).doesNotContainPattern("[il1Lo0O]");
  }

  @Test
  void generate_pickCharactersByRandomIndex() {
    when(randomProvider.nextIndex(anyInt())).thenReturn(0);
    PasswordGenerator fixed = new PasswordGenerator(randomProvider);

    assertThat(fixed.generate(3, EnumSet.of(CharacterClass.LOWER, CharacterClass.UPPER))).isEqualTo("AAA");
    assertThat(fixed.generate(2, EnumSet.of(CharacterClass.DIGITS), true)).isEqualTo("22");
  }

  @Test
  void generate_invalidArguments_throw() {
    assertThatThrownBy(() -> generator.generate(8, Set.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> generator.generate(8, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> generator.generate(0, EnumSet.of(CharacterClass.DIGITS)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
