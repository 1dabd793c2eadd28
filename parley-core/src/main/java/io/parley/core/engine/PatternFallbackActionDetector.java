package io.parley.core.engine;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PatternFallbackActionDetector implements FallbackActionDetector {
    static final String RESEARCH = "research";
    static final String LOOKUP_CONTACT = "lookup_contact";

    private static final List<Rule> RULES = List.of(
        // CRM
        rule("(pipeline|quota)", "get_pipeline"),
        rule("(biggest deal|largest deal|biggest opportunity)", "get_biggest_deal"),
        rule("(stale deals?|deals? gone dark|neglected deals?|deals? at risk)", "get_stale_deals"),
        rule("(closing this week|what.?s closing soon)", "get_deals_closing", Map.of("period", "this_week")),
        rule("closing this month", "get_deals_closing", Map.of("period", "this_month")),
        rule("decision maker", "get_decision_maker"),
        // engagement
        rule("(hot leads?|who.?s engaged|hot prospects?|buying signals?)", "get_hot_leads"),
        rule("(who opened|email opens?)", "get_email_opens"),
        rule("(who clicked|email clicks?|any clicks?)", "get_email_clicks"),
        rule("(any replies|who replied)", "get_replies"),
        rule("(activity stats?|my numbers|how many calls|my activity)", "get_activity_stats"),
        // meetings
        rule("(action items?|to.?dos? from meetings?)", "get_action_items"),
        rule("(overdue items?|overdue tasks?|any overdue)", "get_overdue_items"),
        rule("(last meeting|last call)", "last_meeting"),
        rule("(today.?s meetings?|meetings? today|what meetings? do i have)", "get_today_meetings"),
        rule("transcript", "get_transcript"),
        rule("(talk ratio|how much did i talk)", "get_talk_ratio"),
        // calendar and mail
        rule("(what.?s on my calendar|calendar|my schedule)", "check_calendar", Map.of("days", 1)),
        rule("(check my email|new emails?|unread emails?|check email)", "get_unread_emails"),
        rule("(free slots?|am i free|when am i free)", "find_free_time"),
        // general
        rule("(briefing|brief me|catch me up|what.?s happening)", "morning_briefing"),
        rule("remind me", "create_reminder"),
        rule("(log.*(call|meeting|activity)|record.*(call|meeting))", "log_call"),
        rule("(prep me|prepare.*(for|me)|meeting prep)", "meeting_prep"),
        rule("(search.*(web|for)|research)", RESEARCH),
        rule("(what should i (be doing|do|focus on|work on)|priorit(y|ies)|what(.?s| is) (important|urgent))", "get_priorities")
    );

    private static final Pattern CONTACT_PATTERN = Pattern.compile(
        "\\b(look\\s*up|find|search\\s*for|who\\s*is|tell me about|what.?s\\s+\\w+.?s\\s+(phone|email|number|contact))\\b",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern CONTACT_NAME = Pattern.compile(
        "(?:look\\s*up|find|search\\s*for|who\\s*is)\\s+(.+?)(?:\\?|$|'s)",
        Pattern.CASE_INSENSITIVE
    );

    @Override
    public List<SuggestedAction> detectFallbackActions(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(text).find()) {
                Map<String, Object> params = RESEARCH.equals(rule.action()) ? Map.of("query", text) : rule.params();
                return List.of(new SuggestedAction(rule.action(), params, null));
            }
        }
        if (CONTACT_PATTERN.matcher(text).find()) {
            Matcher name = CONTACT_NAME.matcher(text);
            String contact = name.find() ? name.group(1).trim() : text.trim();
            return List.of(new SuggestedAction(LOOKUP_CONTACT, Map.of("name", contact), null));
        }
        return List.of();
    }

    private static Rule rule(String regex, String action) {
        return rule(regex, action, Map.of());
    }

    private static Rule rule(String regex, String action, Map<String, Object> params) {
        return new Rule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), action, params);
    }

    private record Rule(Pattern pattern, String action, Map<String, Object> params) {
    }
}
