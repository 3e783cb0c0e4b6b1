package com.nisfix.compliance.config;

import com.nisfix.compliance.application.AuthService;
import com.nisfix.compliance.application.TokenIssuer;
import com.nisfix.compliance.domain.SecureLink;
import com.nisfix.compliance.domain.User;
import com.nisfix.compliance.domain.ports.OrganizationRepository;
import com.nisfix.compliance.domain.ports.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.Optional;

/**
 * Operator command: {@code --issue-magic-link=<email> [--base-url=<url>]} prints a sign-in link
 * for an existing active user and stops the application.
 */
@Component
public class MagicLinkCliRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(MagicLinkCliRunner.class);

    static final String OPTION = "issue-magic-link";
    static final String BASE_URL_OPTION = "base-url";

    private final TokenIssuer tokenIssuer;
    private final UserRepository users;
    private final OrganizationRepository organizations;
    private final AppProperties props;
    private final ConfigurableApplicationContext context;

    public MagicLinkCliRunner(TokenIssuer tokenIssuer, UserRepository users, OrganizationRepository organizations,
                              AppProperties props, ConfigurableApplicationContext context) {
        this.tokenIssuer = tokenIssuer;
        this.users = users;
        this.organizations = organizations;
        this.props = props;
        this.context = context;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION)) {
            return;
        }
        String email = first(args.getOptionValues(OPTION));
        String baseUrl = Optional.ofNullable(first(args.getOptionValues(BASE_URL_OPTION)))
                .orElse(props.getMagicLink().getBaseUrl());

        int code = issue(email, baseUrl, System.out);
        System.exit(SpringApplication.exit(context, () -> code));
    }

    /**
     * @return process exit code, 0 when a link was printed
     */
    int issue(String email, String baseUrl, PrintStream out) {
        if (email == null || email.isBlank()) {
            log.error("--{} requires an email address", OPTION);
            return 2;
        }
        Optional<User> user = users.findByEmail(User.normalizeEmail(email));
        if (user.isEmpty() || !user.get().canLogin()) {
            log.error("No active user found with email '{}'", email);
            return 1;
        }
        boolean orgLive = organizations.findById(user.get().getOrganizationId())
                .filter(o -> !o.isDeleted())
                .isPresent();
        if (!orgLive) {
            log.error("Organization not found for user '{}'", email);
            return 1;
        }

        SecureLink link = tokenIssuer.issueSignInLink(user.get());
        out.println("Magic link: " + AuthService.signInUrl(baseUrl, link));
        out.println("Expires at: " + link.getExpiresAt());
        log.info("Issued magic link for {} from the command line", user.get().getId());
        return 0;
    }

    private static String first(List<String> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
