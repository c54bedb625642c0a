package com.al.shopsync.service.sync;

import com.al.shopsync.client.TargetSystemClient;
import com.al.shopsync.config.ShopSyncProperties;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.MatchAction;
import com.al.shopsync.model.enums.SyncMode;
import com.al.shopsync.service.path.PathResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class TargetMatcherTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private TargetSystemClient targetClient;

    private ShopSyncProperties properties;
    private TargetMatcher matcher;

    @BeforeEach
    public void setUp() {
        properties = new ShopSyncProperties();
        matcher = new TargetMatcher(targetClient, new PathResolver(), properties);
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text.replace('\'', '"'));
    }

    @Test
    public void testResolveTarget_CreateNeverLooksUp() throws Exception {
        MatchDecision decision = matcher.resolveTarget(EntityType.ARTICLES, "1", json("{'mainDetail':{'number':'A'}}"),
                json("{}"), SyncMode.CREATE, new SyncContext());

        assertEquals(MatchAction.CREATE, decision.getAction());
        verifyNoInteractions(targetClient);
    }

    @Test
    public void testResolveTarget_UpsertFoundUpdates() throws Exception {
        when(targetClient.findByNaturalKey(EntityType.ARTICLES, "SW-1")).thenReturn(Optional.of(json("{'id':77}")));

        MatchDecision decision = matcher.resolveTarget(EntityType.ARTICLES, "1",
                json("{'mainDetail':{'number':'SW-1'}}"), json("{}"), SyncMode.UPSERT, new SyncContext());

        assertEquals(MatchAction.UPDATE, decision.getAction());
        assertEquals(77L, decision.getTargetId());
    }

    @Test
    public void testResolveTarget_UpsertNotFoundCreates() throws Exception {
        when(targetClient.findByNaturalKey(EntityType.CUSTOMERS, "a@example.com")).thenReturn(Optional.empty());

        MatchDecision decision = matcher.resolveTarget(EntityType.CUSTOMERS, "5", json("{'email':'a@example.com'}"),
                json("{}"), SyncMode.UPSERT, new SyncContext());

        assertEquals(MatchAction.CREATE, decision.getAction());
    }

    @Test
    public void testResolveTarget_UpdateNotFoundSkipsWithError() throws Exception {
        when(targetClient.findByNaturalKey(EntityType.CUSTOMERS, "a@example.com")).thenReturn(Optional.empty());

        MatchDecision decision = matcher.resolveTarget(EntityType.CUSTOMERS, "5", json("{'email':'a@example.com'}"),
                json("{}"), SyncMode.UPDATE, new SyncContext());

        assertEquals(MatchAction.SKIP, decision.getAction());
        assertTrue(decision.getError().contains("a@example.com"));
    }

    @Test
    public void testResolveTarget_FallsBackToContextLink() throws Exception {
        when(targetClient.findByNaturalKey(EntityType.ARTICLES, "SW-1")).thenReturn(Optional.empty());
        SyncContext context = new SyncContext();
        context.recordLink("1", 55L);

        MatchDecision decision = matcher.resolveTarget(EntityType.ARTICLES, "1",
                json("{'mainDetail':{'number':'SW-1'}}"), json("{}"), SyncMode.UPSERT, context);

        assertEquals(MatchAction.UPDATE, decision.getAction());
        assertEquals(55L, decision.getTargetId());
    }

    @Test
    public void testResolveTarget_NoKeyUsesContextOnly() throws Exception {
        SyncContext context = new SyncContext();
        context.recordLink("9", 12L);

        MatchDecision decision = matcher.resolveTarget(EntityType.CUSTOMERS, "9", json("{}"), json("{}"),
                SyncMode.UPDATE, context);

        assertEquals(MatchAction.UPDATE, decision.getAction());
        verify(targetClient, never()).findByNaturalKey(any(), any());
    }

    @Test
    public void testResolveTarget_ReadOnlyMatchedOrSkipped() throws Exception {
        when(targetClient.findByNaturalKey(EntityType.ORDERS, "20001")).thenReturn(Optional.of(json("{'id':'900'}")));
        when(targetClient.findByNaturalKey(EntityType.ORDERS, "20002")).thenReturn(Optional.empty());

        MatchDecision matched = matcher.resolveTarget(EntityType.ORDERS, "1", json("{'number':'20001'}"), json("{}"),
                SyncMode.UPSERT, new SyncContext());
        MatchDecision missing = matcher.resolveTarget(EntityType.ORDERS, "2", json("{'number':'20002'}"), json("{}"),
                SyncMode.UPSERT, new SyncContext());

        assertEquals(MatchAction.SKIP, matched.getAction());
        assertNull(matched.getError());
        assertEquals(900L, matched.getTargetId());
        assertEquals(MatchAction.SKIP, missing.getAction());
        assertNotNull(missing.getError());
    }

    @Test
    public void testNaturalKeyOf_MappedFallbackAndOverride() throws Exception {
        assertEquals("SKU-1", matcher.naturalKeyOf(EntityType.ARTICLES, json("{}"),
                json("{'variants':[{'sku':'SKU-1'},{'sku':'SKU-2'}]}")));
        assertEquals("SKU-2", matcher.naturalKeyOf(EntityType.ARTICLES, json("{}"),
                json("{'variants':[{'price':5},{'sku':'SKU-2'}]}")));
        assertNull(matcher.naturalKeyOf(EntityType.ARTICLES, json("{'mainDetail':{'number':'  '}}"), json("{}")));

        properties.getMapping().getNaturalKeys().put("customers", "attribute.legacyMail");
        TargetMatcher overridden = new TargetMatcher(targetClient, new PathResolver(), properties);
        assertEquals("old@example.com", overridden.naturalKeyOf(EntityType.CUSTOMERS,
                json("{'email':'new@example.com','attribute':{'legacyMail':'old@example.com'}}"), null));
    }
}
