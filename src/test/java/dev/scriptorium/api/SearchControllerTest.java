package dev.scriptorium.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.scriptorium.content.ContentType;
import dev.scriptorium.model.ModelUnavailableException;
import dev.scriptorium.search.EntryNotFoundException;
import dev.scriptorium.search.SearchProperties;
import dev.scriptorium.search.SearchRequest;
import dev.scriptorium.search.SearchResult;
import dev.scriptorium.search.SearchService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchController.class)
@Import(SearchProperties.class)
class SearchControllerTest {

  private static final String ENTRY_ID = "3f2504e0-4f89-41d3-9a0c-0305e82c3301";

  @Autowired MockMvc mockMvc;

  @MockitoBean SearchService searchService;

  @Test
  void searchReturnsHitsInWireFormat() throws Exception {
    when(searchService.search(eq("alice"), any()))
        .thenReturn(
            List.of(
                new SearchResult(
                    ENTRY_ID, "Tides follow the moon", 0.83, 2.5, "notes/tides.md",
                    ContentType.MARKDOWN, null),
                new SearchResult(
                    "b", "[image] beach", 0.61, null, "photos/beach.png", ContentType.IMAGE,
                    "/api/images/alice/abc.png")));

    mockMvc
        .perform(
            get("/api/search")
                .param("q", "moon tides")
                .param("r", "true")
                .param("n", "2")
                .header(Accounts.HEADER, "alice"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value(ENTRY_ID))
        .andExpect(jsonPath("$[0].entry").value("Tides follow the moon"))
        .andExpect(jsonPath("$[0].file").value("notes/tides.md"))
        .andExpect(jsonPath("$[0].contentType").value("markdown"))
        .andExpect(jsonPath("$[0].rerankScore").value(2.5))
        .andExpect(jsonPath("$[0].image").doesNotExist())
        .andExpect(jsonPath("$[1].rerankScore").doesNotExist())
        .andExpect(jsonPath("$[1].image").value("/api/images/alice/abc.png"));

    verify(searchService)
        .search("alice", new SearchRequest("moon tides", null, 2, true));
  }

  @Test
  void typeFilterAndDefaultResultCountAreApplied() throws Exception {
    when(searchService.search(eq("default"), any())).thenReturn(List.of());

    mockMvc
        .perform(get("/api/search").param("q", "invoice").param("t", "pdf"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$").isEmpty());

    verify(searchService)
        .search("default", new SearchRequest("invoice", ContentType.PDF, 5, false));
  }

  @Test
  void blankQueryIsBadRequest() throws Exception {
    mockMvc.perform(get("/api/search").param("q", "  ")).andExpect(status().isBadRequest());

    verifyNoInteractions(searchService);
  }

  @Test
  void missingQueryIsBadRequest() throws Exception {
    mockMvc.perform(get("/api/search")).andExpect(status().isBadRequest());
  }

  @Test
  void resultCountOutsideLimitIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/search").param("q", "x").param("n", "0"))
        .andExpect(status().isBadRequest());
    mockMvc
        .perform(get("/api/search").param("q", "x").param("n", "101"))
        .andExpect(status().isBadRequest());

    verify(searchService, never()).search(anyString(), any());
  }

  @Test
  void unknownContentTypeIsBadRequest() throws Exception {
    mockMvc
        .perform(get("/api/search").param("q", "x").param("t", "video"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unavailableModelIs503() throws Exception {
    when(searchService.search(anyString(), any()))
        .thenThrow(new ModelUnavailableException("embed query", "Model call timed out"));

    mockMvc
        .perform(get("/api/search").param("q", "x"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.operation").value("embed query"));
  }

  @Test
  void similarLooksUpEntryForAccount() throws Exception {
    when(searchService.findSimilar("alice", ENTRY_ID, null, 3, false)).thenReturn(List.of());

    mockMvc
        .perform(
            get("/api/search/similar")
                .param("id", ENTRY_ID)
                .param("n", "3")
                .header(Accounts.HEADER, "alice"))
        .andExpect(status().isOk());

    verify(searchService).findSimilar(eq("alice"), eq(ENTRY_ID), isNull(), eq(3), eq(false));
  }

  @Test
  void similarForUnknownEntryIs404() throws Exception {
    when(searchService.findSimilar(anyString(), anyString(), any(), anyInt(), anyBoolean()))
        .thenThrow(new EntryNotFoundException(ENTRY_ID));

    mockMvc
        .perform(get("/api/search/similar").param("id", ENTRY_ID))
        .andExpect(status().isNotFound());
  }
}
