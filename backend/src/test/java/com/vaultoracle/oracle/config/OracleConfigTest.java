package com.vaultoracle.oracle.config;

import com.vaultoracle.oracle.OracleWhitelist;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OracleConfigTest {

    @Test
    void whitelist_paddedWithDummy() {
        OracleProperties properties = properties(2, 3);

        OracleWhitelist whitelist = OracleConfig.buildWhitelist(properties);

        assertThat(whitelist.addresses()).containsExactly("B62q0", "B62q1", "B62qdummy");
    }

    @Test
    void whitelist_tooManyParticipants_throws() {
        OracleProperties properties = properties(4, 3);

        assertThatThrownBy(() -> OracleConfig.buildWhitelist(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("max-participants");
    }

    @Test
    void whitelist_paddingWithoutDummyKey_throws() {
        OracleProperties properties = properties(1, 3);
        properties.setDummyPublicKey(null);

        assertThatThrownBy(() -> OracleConfig.buildWhitelist(properties)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void whitelist_fullWithoutDummyKey_ok() {
        OracleProperties properties = properties(3, 3);
        properties.setDummyPublicKey(null);

        assertThat(OracleConfig.buildWhitelist(properties).size()).isEqualTo(3);
    }

    private static OracleProperties properties(int participants, int slots) {
        OracleProperties properties = new OracleProperties();
        properties.setMaxParticipants(slots);
        properties.setDummyPublicKey("B62qdummy");
        List<OracleProperties.Participant> list = new ArrayList<>();
        for (int i = 0; i < participants; i++) {
            OracleProperties.Participant p = new OracleProperties.Participant();
            p.setPublicKey("B62q" + i);
            p.setPrivateKey("EK" + i);
            list.add(p);
        }
        properties.setParticipants(list);
        return properties;
    }
}
