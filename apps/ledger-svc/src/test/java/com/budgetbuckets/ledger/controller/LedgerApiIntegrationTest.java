package com.budgetbuckets.ledger.controller;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
class LedgerApiIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Test
    void overPlannedBudgetIsFundedRolledOverAndReset() throws Exception {
        String userId = createUser("Robin");
        postJson("/users/" + userId + "/income", "{\"amount\":1000,\"note\":\"Salary\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.recurring").value(true));

        postJson("/users/" + userId + "/buckets",
                "{\"name\":\"Rent\",\"mode\":\"SPEND\",\"allocationType\":\"AMOUNT\",\"allocationValue\":700}")
                .andExpect(status().isCreated());
        String foodId = id(postJson("/users/" + userId + "/buckets",
                "{\"name\":\"Food\",\"mode\":\"SPEND\",\"allocationType\":\"AMOUNT\",\"allocationValue\":500}")
                .andExpect(status().isCreated())
                .andReturn());

        mockMvc.perform(get("/users/" + userId + "/buckets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[?(@.name == 'Rent')].fundedAmount", contains(583.33)))
                .andExpect(jsonPath("$[?(@.name == 'Food')].fundedAmount", contains(416.67)));

        mockMvc.perform(get("/users/" + userId + "/distribution"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPlanned").value(1200.0))
                .andExpect(jsonPath("$.overPlannedBy").value(200.0));

        postJson("/users/" + userId + "/expenses",
                "{\"bucketId\":\"" + foodId + "\",\"amount\":100,\"date\":\"2020-01-15T10:00:00Z\",\"note\":\"Market\"}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.autoGenerated").value(false));

        mockMvc.perform(get("/users/" + userId + "/spending").param("month", "2020-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSpent").value(100.0))
                .andExpect(jsonPath("$.transactionCount").value(1));

        mockMvc.perform(post("/users/" + userId + "/rollovers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bucketsProcessed").value(2));

        mockMvc.perform(get("/users/" + userId + "/buckets/" + foodId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.carryoverBalance").value(316.67))
                .andExpect(jsonPath("$.fundedAmount").value(416.67))
                .andExpect(jsonPath("$.lastRolloverDate").exists());

        mockMvc.perform(get("/users/" + userId + "/rollovers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));

        mockMvc.perform(delete("/users/" + userId + "/data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bucketsDeleted").value(2))
                .andExpect(jsonPath("$.incomesDeleted").value(1))
                .andExpect(jsonPath("$.expensesDeleted").value(1))
                .andExpect(jsonPath("$.rolloverEntriesDeleted").value(2));

        mockMvc.perform(get("/users/" + userId + "/buckets"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(get("/users/" + userId))
                .andExpect(status().isOk());
    }

    @Test
    void saveBucketReceivesContributionOnRollover() throws Exception {
        String userId = createUser("Sam");
        postJson("/users/" + userId + "/income", "{\"amount\":3000}").andExpect(status().isCreated());
        String tripId = id(postJson("/users/" + userId + "/buckets",
                "{\"name\":\"Trip\",\"mode\":\"SAVE\",\"targetAmount\":1000,\"contributionType\":\"AMOUNT\",\"contributionValue\":250}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.currentBalance").value(0.0))
                .andExpect(jsonPath("$.fundedAmount").doesNotExist())
                .andReturn());

        mockMvc.perform(post("/users/" + userId + "/rollovers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].status").value("APPLIED"));
        mockMvc.perform(post("/users/" + userId + "/rollovers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].status").value("ALREADY_CONTRIBUTED"));

        mockMvc.perform(get("/users/" + userId + "/buckets/" + tripId))
                .andExpect(jsonPath("$.currentBalance").value(250.0));
    }

    @Test
    void errorsCarryCodeAndTrace() throws Exception {
        String unknown = UUID.randomUUID().toString();
        mockMvc.perform(get("/users/" + unknown + "/buckets").header("X-Request-Trace", "trace-abc"))
                .andExpect(status().isNotFound())
                .andExpect(header().string("X-Request-Trace", "trace-abc"))
                .andExpect(jsonPath("$.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.details.resource").value("User"))
                .andExpect(jsonPath("$.traceId").value("trace-abc"));

        String userId = createUser("Alex");
        postJson("/users/" + userId + "/buckets",
                "{\"name\":\"Fun\",\"mode\":\"SPEND\",\"allocationType\":\"PERCENTAGE\",\"allocationValue\":150}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_CONFIGURATION"))
                .andExpect(jsonPath("$.details.field").value("allocationValue"));

        String funId = id(postJson("/users/" + userId + "/buckets",
                "{\"name\":\"Fun\",\"mode\":\"SPEND\",\"allocationType\":\"PERCENTAGE\",\"allocationValue\":10}")
                .andExpect(status().isCreated())
                .andReturn());
        mockMvc.perform(put("/users/" + userId + "/buckets/" + funId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"SAVE\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.field").value("mode"));

        postJson("/users/" + userId + "/expenses", "{\"amount\":5}")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/users/" + userId + "/buckets").param("month", "June"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void legacyBucketsAreImportedAsSpendBuckets() throws Exception {
        String userId = createUser("Kim");
        postJson("/users/" + userId + "/buckets/legacy-migrations",
                "{\"buckets\":[{\"name\":\"Groceries\",\"allocationType\":\"AMOUNT\",\"allocationValue\":200,\"currentBalance\":42.5}]}")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.migrated").value(1));

        mockMvc.perform(get("/users/" + userId + "/buckets"))
                .andExpect(jsonPath("$[0].mode").value("SPEND"))
                .andExpect(jsonPath("$[0].carryoverBalance").value(42.5));
    }

    private String createUser(String name) throws Exception {
        return id(postJson("/users", "{\"name\":\"" + name + "\"}")
                .andExpect(status().isCreated())
                .andReturn());
    }

    private ResultActions postJson(String path, String body) throws Exception {
        return mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
    }

    private static String id(MvcResult result) throws Exception {
        return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
    }
}
