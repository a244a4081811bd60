package com.jz.moderation.policy;

import com.jz.moderation.common.InvalidSettingsException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextPolicyTableTest {

    private static Map<String, ContextPolicy> entries(ContextPolicy... policies) {
        Map<String, ContextPolicy> m = new LinkedHashMap<>();
        for (ContextPolicy p : policies) m.put(p.getContextType(), p);
        return m;
    }

    @Test
    void defaults_keepDefaultEntryStrictest() {
        ContextPolicyTable t = ContextPolicyTable.defaults();
        ContextPolicy d = t.getDefaultPolicy();

        assertEquals(ContextPolicyTable.PUBLIC_GALLERY, d.getContextType());
        for (ContextPolicy p : t.getPolicies().values()) {
            assertTrue(p.getAutoApproveThreshold() >= d.getAutoApproveThreshold(), p.getContextType());
            assertTrue(p.getAutoRejectThreshold() >= d.getAutoRejectThreshold(), p.getContextType());
        }
        assertEquals(70, t.resolve(ContextPolicyTable.PAYSITE_CONTENT).getAutoApproveThreshold());
        assertEquals(90, t.resolve(ContextPolicyTable.PAYSITE_CONTENT).getAutoRejectThreshold());
    }

    @Test
    void unknownOrBlankKey_resolvesToDefault() {
        ContextPolicyTable t = ContextPolicyTable.defaults();
        assertSame(t.getDefaultPolicy(), t.resolve("dating_app"));
        assertSame(t.getDefaultPolicy(), t.resolve(null));
        assertSame(t.getDefaultPolicy(), t.resolve("  "));
        assertSame(t.resolve("private_gallery"), t.resolve(" private_gallery "));
    }

    @Test
    void entryStricterThanDefault_isRejected() {
        ContextPolicy base = new ContextPolicy("public_gallery", 20, 80);

        InvalidSettingsException lowerApprove = assertThrows(InvalidSettingsException.class,
                () -> ContextPolicyTable.of("public_gallery", entries(base, new ContextPolicy("kids_zone", 15, 90))));
        assertTrue(lowerApprove.getMessage().contains("kids_zone"));
        assertThrows(InvalidSettingsException.class,
                () -> ContextPolicyTable.of("public_gallery", entries(base, new ContextPolicy("kids_zone", 30, 70))));

        ContextPolicyTable ok = ContextPolicyTable.of("public_gallery",
                entries(base, new ContextPolicy("same_as_default", 20, 80), new ContextPolicy("loose", 60, 95)));
        assertEquals(3, ok.getPolicies().size());
    }

    @Test
    void with_revalidatesAgainstDefault() {
        ContextPolicyTable t = ContextPolicyTable.defaults();
        assertThrows(InvalidSettingsException.class, () -> t.with(new ContextPolicy("profile_pic", 15, 70)));
        assertThrows(InvalidSettingsException.class, () -> t.with(new ContextPolicy("public_gallery", 65, 85)));
        assertEquals(85, t.with(new ContextPolicy("profile_pic", 25, 85)).resolve("profile_pic").getAutoRejectThreshold());
    }
}
