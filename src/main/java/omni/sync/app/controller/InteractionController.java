package omni.sync.app.controller;

import omni.sync.app.repository.InteractionRepository;
import omni.sync.app.service.UserService;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side for downstream consumers; newest first.
 */
@RestController
@RequestMapping("/api/interactions")
public class InteractionController {
    private static final int MAX_PAGE_SIZE = 200;

    private final InteractionRepository interactionRepository;
    private final UserService userService;

    public InteractionController(InteractionRepository interactionRepository, UserService userService) {
        this.interactionRepository = interactionRepository;
        this.userService = userService;
    }

    @GetMapping
    public Page<InteractionView> list(@RequestParam(value = "page", defaultValue = "0") int page,
                                      @RequestParam(value = "size", defaultValue = "50") int size,
                                      Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        PageRequest pageRequest = PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), MAX_PAGE_SIZE));
        return interactionRepository.findByUserIdOrderByOccurredAtDesc(userId, pageRequest)
                .map(InteractionView::from);
    }
}
