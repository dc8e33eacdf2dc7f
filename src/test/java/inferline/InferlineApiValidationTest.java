package inferline;

import static org.springframework.http.MediaType.APPLICATION_JSON;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class InferlineApiValidationTest {
  @Autowired MockMvc mvc;

  @Test
  void missingModelReturns400ProblemDetail() throws Exception {
    mvc.perform(post("/v1/requests")
            .contentType(APPLICATION_JSON)
            .content("""
                {"payload":{"prompt":"hi"}}
                """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("validation_failed"))
        .andExpect(jsonPath("$.fields.model").exists());
  }

  @Test
  void malformedJsonReturns400() throws Exception {
    mvc.perform(post("/v1/requests")
            .contentType(APPLICATION_JSON)
            .content("{\"model\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("malformed_json"));
  }

  @Test
  void completionWithoutModelReturns400() throws Exception {
    mvc.perform(post("/v1/completions")
            .contentType(APPLICATION_JSON)
            .content("""
                {"prompt":"hi"}
                """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("validation_failed"))
        .andExpect(jsonPath("$.fields.model").exists());
  }

  @Test
  void pollWithoutCapabilitiesReturns400() throws Exception {
    mvc.perform(post("/v1/queue/next")
            .contentType(APPLICATION_JSON)
            .content("""
                {"providerId":"p-validation"}
                """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.fields.supportedModels").exists());
  }

  @Test
  void resultWithoutRequestIdReturns400() throws Exception {
    mvc.perform(post("/v1/queue/result")
            .contentType(APPLICATION_JSON)
            .content("""
                {"resultData":{"text":"orphan"}}
                """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.fields.requestId").exists());
  }

  @Test
  void registeredPollWithoutProviderIdReturns400() throws Exception {
    mvc.perform(get("/v1/queue/next"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("validation_failed"))
        .andExpect(jsonPath("$.fields.providerId").exists());
  }

  @Test
  void nonNumericTimeoutReturns400() throws Exception {
    mvc.perform(post("/v1/completions")
            .param("timeoutMs", "abc")
            .contentType(APPLICATION_JSON)
            .content("""
                {"model":"m-validation","prompt":"hi"}
                """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("validation_failed"))
        .andExpect(jsonPath("$.fields.timeoutMs").value("must be Long"));
  }
}
