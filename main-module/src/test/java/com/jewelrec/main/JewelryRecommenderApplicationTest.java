package com.jewelrec.main;

import com.jewelrec.main.config.RecommenderProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
    "jewelry.storage.type=memory",
    "jewelry.pools.embeddings-dir=target/no-embeddings"
})
@AutoConfigureMockMvc
class JewelryRecommenderApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RecommenderProperties properties;

    @Test
    void contextStartsWithLazyPools() throws Exception {
        assertThat(properties.getPersonalization().getHalfLifeDays()).isEqualTo(30.0);
        assertThat(properties.getStorage().getType()).isEqualTo(RecommenderProperties.StorageType.MEMORY);

        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(content().string("UP"));
        mockMvc.perform(get("/api/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pools").isEmpty());
    }

    @Test
    void unknownUserHasEmptySummary() throws Exception {
        mockMvc.perform(get("/api/users/nobody"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.exists").value(false))
            .andExpect(jsonPath("$.sparse").value(true));
    }
}
