package dao.bmn.escrow.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.bmn.escrow.model.Timelocks;
import dao.bmn.escrow.util.CryptoUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

import static dao.bmn.escrow.TestFixtures.*;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {"scheduler.keeper.enabled=false", "endorsement.private-key="})
@AutoConfigureMockMvc
class EscrowControllerTest {

    private static final String TIMELOCKS = Timelocks.pack(0, 60, 3600, 3660, 0, 60, 3000).toHex();

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    private byte[] secret;
    private String hashlock;

    @BeforeEach
    void setUp() {
        secret = CryptoUtil.randomBytes32();
        hashlock = CryptoUtil.hashlockOf(secret);
    }

    @Test
    void factoryInfo() throws Exception {
        mvc.perform(get("/api/chains/1/admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.owner").value(OWNER))
                .andExpect(jsonPath("$.resolvers", hasItem(RESOLVER)));
    }

    @Test
    void nonOwnerCannotPause() throws Exception {
        mvc.perform(post("/api/chains/1/admin/pause")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("caller", STRANGER, "enabled", true))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.code").value("NOT_OWNER"))
                .andExpect(jsonPath("$.category").value("AUTHORIZATION"));
    }

    @Test
    void unknownChainIsNotFound() throws Exception {
        mvc.perform(get("/api/chains/56/admin"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("UNKNOWN_CHAIN"));
    }

    @Test
    void unknownHashlockIsNotFound() throws Exception {
        mvc.perform(get("/api/chains/1/escrows/" + hashlock))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("ESCROW_NOT_FOUND"));
    }

    @Test
    void predictIsChainIndependent() throws Exception {
        Map<String, Object> body = Map.of("role", "DESTINATION", "immutables", immutables(hashlock, NATIVE));

        String onEthereum = address(mvc.perform(post("/api/chains/1/escrows/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(body)))
                .andExpect(status().isOk())
                .andReturn());
        String onBase = address(mvc.perform(post("/api/chains/8453/escrows/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(body)))
                .andExpect(status().isOk())
                .andReturn());

        assertEquals(onEthereum, onBase);
    }

    @Test
    void destinationLifecycle() throws Exception {
        long now = System.currentTimeMillis() / 1000;
        Map<String, Object> create = Map.of(
                "caller", RESOLVER,
                "srcCancellationTimestamp", now + 4000,
                "immutables", immutables(hashlock, NATIVE));

        MvcResult created = mvc.perform(post("/api/chains/8453/escrows/destination")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(create)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.escrow.role").value("DESTINATION"))
                .andExpect(jsonPath("$.escrow.state").value("ACTIVE"))
                .andExpect(jsonPath("$.escrow.balance").value("1010"))
                .andReturn();
        String escrow = objectMapper.readTree(created.getResponse().getContentAsString()).path("escrow").path("address").asText();

        mvc.perform(post("/api/chains/8453/escrows/destination")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(create)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ESCROW_ALREADY_EXISTS"));

        mvc.perform(post("/api/chains/8453/escrows/" + escrow + "/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("caller", STRANGER, "secret", CryptoUtil.toHex0x(secret)))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INVALID_CALLER"));

        mvc.perform(post("/api/chains/8453/escrows/" + escrow + "/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("caller", RESOLVER, "secret", CryptoUtil.toHex0x(secret)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.escrow.state").value("WITHDRAWN"))
                .andExpect(jsonPath("$.escrow.balance").value("0"));

        mvc.perform(get("/api/chains/8453/escrows/" + hashlock))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.escrow.address").value(escrow));

        mvc.perform(get("/api/chains/8453/journal"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries[*].emitter", hasItem(escrow)));
    }

    @Test
    void missingFieldsAreRejected() throws Exception {
        Map<String, Object> immutables = immutables(hashlock, NATIVE);
        immutables.remove("taker");

        mvc.perform(post("/api/chains/1/escrows/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", "SOURCE", "immutables", immutables))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PAYLOAD"))
                .andExpect(jsonPath("$.validationErrors['immutables.taker']").exists());
    }

    @Test
    void malformedAmountIsRejected() throws Exception {
        Map<String, Object> immutables = immutables(hashlock, NATIVE);
        immutables.put("amount", "lots");

        mvc.perform(post("/api/chains/1/escrows/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", "SOURCE", "immutables", immutables))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PAYLOAD"));
    }

    @Test
    void negativeDestinationAmountIsBadRequest() throws Exception {
        Map<String, Object> immutables = immutables(hashlock, NATIVE);
        immutables.put("amount", "-5");
        Map<String, Object> create = Map.of(
                "caller", RESOLVER,
                "srcCancellationTimestamp", System.currentTimeMillis() / 1000 + 4000,
                "immutables", immutables);

        mvc.perform(post("/api/chains/8453/escrows/destination")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(create)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PAYLOAD"));

        mvc.perform(get("/api/chains/8453/escrows/" + hashlock))
                .andExpect(status().isNotFound());
    }

    @Test
    void oversizedSafetyDepositIsBadRequest() throws Exception {
        Map<String, Object> immutables = immutables(hashlock, NATIVE);
        immutables.put("safetyDeposit", BigInteger.ONE.shiftLeft(256).toString());

        mvc.perform(post("/api/chains/1/escrows/predict")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("role", "SOURCE", "immutables", immutables))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PAYLOAD"));
    }

    private Map<String, Object> immutables(String hashlock, String token) {
        Map<String, Object> im = new LinkedHashMap<>();
        im.put("orderHash", ORDER_HASH);
        im.put("hashlock", hashlock);
        im.put("maker", MAKER);
        im.put("taker", RESOLVER);
        im.put("token", token);
        im.put("amount", "1000");
        im.put("safetyDeposit", "10");
        im.put("timelocks", TIMELOCKS);
        return im;
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private String address(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString()).path("address").asText();
    }
}
