package quest.gekko.insight.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.insight.provider.ChannelInfo;
import quest.gekko.insight.provider.DataProvider;
import quest.gekko.insight.service.store.CompetitorStore;
import quest.gekko.insight.web.dto.AddCompetitorRequest;
import quest.gekko.insight.web.dto.CompetitorDTO;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/competitors")
@RequiredArgsConstructor
public class CompetitorController {
    private final DataProvider provider;
    private final CompetitorStore competitorStore;

    @GetMapping
    public List<CompetitorDTO> competitors() {
        return competitorStore.getCompetitors().stream().map(CompetitorDTO::from).toList();
    }

    // Resolves the public profile first so unknown ids are rejected before anything is stored
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CompetitorDTO add(@Valid @RequestBody AddCompetitorRequest request) {
        ChannelInfo info = provider.getPublicChannel(request.channelId().trim());
        log.info("Tracking competitor {} ({})", info.id(), info.title());
        return CompetitorDTO.from(competitorStore.addCompetitor(info));
    }
}
