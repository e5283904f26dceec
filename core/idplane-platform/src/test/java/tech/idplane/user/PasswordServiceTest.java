package tech.idplane.user;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PasswordService")
class PasswordServiceTest {

    private final PasswordService service = new PasswordService();

    // ========================================================================
    // Hashing
    // ========================================================================

    @Nested
    @DisplayName("hashPassword")
    class HashPasswordTests {

        @Test
        @DisplayName("should produce an Argon2id hash with the configured parameters")
        void hashPassword_shouldProduceArgon2idHash() {
            String hash = service.hashPassword("correct horse");

            assertThat(hash).startsWith("$argon2id$");
            assertThat(hash).contains("m=65536").contains("t=3").contains("p=4");
        }

        @Test
        @DisplayName("should salt every hash")
        void hashPassword_shouldDiffer_forSamePassword() {
            assertThat(service.hashPassword("correct horse")).isNotEqualTo(service.hashPassword("correct horse"));
        }

        @Test
        @DisplayName("should reject an empty password")
        void hashPassword_shouldThrow_whenEmpty() {
            assertThatThrownBy(() -> service.hashPassword(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Password cannot be null or empty");
        }
    }

    @Nested
    @DisplayName("verifyPassword")
    class VerifyPasswordTests {

        @Test
        @DisplayName("should accept the right password and refuse a wrong one")
        void verifyPassword_shouldMatchOnlyRightPassword() {
            String hash = service.hashPassword("correct horse");

            assertThat(service.verifyPassword("correct horse", hash)).isTrue();
            assertThat(service.verifyPassword("battery staple", hash)).isFalse();
        }

        @Test
        @DisplayName("should refuse a malformed or missing hash")
        void verifyPassword_shouldBeFalse_whenHashMalformed() {
            assertThat(service.verifyPassword("correct horse", "not-a-hash")).isFalse();
            assertThat(service.verifyPassword("correct horse", null)).isFalse();
            assertThat(service.verifyPassword(null, "$argon2id$whatever")).isFalse();
        }
    }

    @Test
    @DisplayName("needsRehash should flag hashes with other parameters")
    void needsRehash_shouldFlagOldParameters() {
        assertThat(service.needsRehash(service.hashPassword("correct horse"))).isFalse();
        assertThat(service.needsRehash("$argon2id$v=19$m=4096,t=3,p=1$c2FsdA$aGFzaA")).isTrue();
        assertThat(service.needsRehash("$2a$10$abcdefghijklmnopqrstuv")).isTrue();
        assertThat(service.needsRehash(null)).isTrue();
    }

    @Test
    @DisplayName("validatePassword should enforce the length bounds")
    void validatePassword_shouldEnforceLength() {
        assertThatThrownBy(() -> service.validatePassword("short"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least 8");
        assertThatThrownBy(() -> service.validatePassword("x".repeat(129)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at most 128");
        assertThatCode(() -> service.validatePassword("x".repeat(8))).doesNotThrowAnyException();
    }
}
