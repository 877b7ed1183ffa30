package com.stickerharvester.stickerbot.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.stickerharvester.stickerbot.config.BotLoopUnavailableException;
import com.stickerharvester.stickerbot.stickerset.RequestOutcome;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(BotAdminController.class)
class BotAdminControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private BotAdminService admin;

  @Test
  void listsStickerSets() throws Exception {
    given(admin.stickerSets())
        .willReturn(List.of(new StickerSetSummary("Cats", "Cats!", 2, 1, false, "FILES_PENDING")));

    mockMvc
        .perform(get("/admin/sticker-sets"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("Cats"))
        .andExpect(jsonPath("$[0].downloadedFiles").value(1))
        .andExpect(jsonPath("$[0].download").value("FILES_PENDING"));
  }

  @Test
  void unknownSetIs404() throws Exception {
    given(admin.stickerSet("Nope")).willThrow(new NotFoundException("Unknown sticker set: Nope"));

    mockMvc
        .perform(get("/admin/sticker-sets/Nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void removingARunningDownloadIs409() throws Exception {
    willThrow(new ConflictException("Sticker set Cats is being downloaded"))
        .given(admin)
        .removeStickerSet("Cats");

    mockMvc.perform(delete("/admin/sticker-sets/Cats")).andExpect(status().isConflict());
  }

  @Test
  void removalAnswersNoContent() throws Exception {
    mockMvc.perform(delete("/admin/sticker-sets/Cats")).andExpect(status().isNoContent());

    verify(admin).removeStickerSet("Cats");
  }

  @Test
  void downloadRequestIsAccepted() throws Exception {
    given(admin.requestDownload(eq("Cats"), any()))
        .willReturn(new DownloadResponse("Cats", RequestOutcome.STARTED));

    mockMvc
        .perform(
            post("/admin/sticker-sets/Cats/downloads")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chatId\": 3}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.outcome").value("STARTED"));
  }

  @Test
  void downloadRequestWithoutChatIs400() throws Exception {
    mockMvc
        .perform(
            post("/admin/sticker-sets/Cats/downloads")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

    verify(admin, never()).requestDownload(any(), any());
  }

  @Test
  void busyLoopIs503() throws Exception {
    given(admin.status())
        .willThrow(new BotLoopUnavailableException("Bot loop did not answer in time", null));

    mockMvc
        .perform(get("/admin/status"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("UNAVAILABLE"));
  }

  @Test
  void otherIllegalStateIs500() throws Exception {
    given(admin.status()).willThrow(new IllegalStateException("unrelated"));

    mockMvc
        .perform(get("/admin/status"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
  }
}
