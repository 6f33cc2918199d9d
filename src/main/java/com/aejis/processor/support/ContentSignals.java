package com.aejis.processor.support;

import com.aejis.core.scoring.SignalCategory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Keyword and pattern scan over decoded text. Each hit becomes a finding tagged with its
 * {@link SignalCategory}, e.g. {@code "SENSITIVE_DATA: password"}.
 */
public final class ContentSignals {

    private record Rule(SignalCategory category, String label, Pattern pattern) {}

    private static final List<Rule> RULES = new ArrayList<>();

    static {
        sensitive("password", "\\bpass(word|wd)");
        sensitive("api key", "\\bapi[_-]?key");
        sensitive("secret", "\\b(client[_-]?)?secret\\b");
        sensitive("access token", "\\b(access|auth|bearer)[_-]?token\\b");
        sensitive("private key block", "-----BEGIN [A-Z ]*PRIVATE KEY-----");
        sensitive("aws access key", "\\bAKIA[0-9A-Z]{16}\\b");
        sensitive("credential", "\\bcredentials?\\b");

        rule(SignalCategory.MALWARE_KEYWORD, "malware", "\\bmalware\\b");
        rule(SignalCategory.MALWARE_KEYWORD, "virus", "\\bvirus\\b");
        rule(SignalCategory.MALWARE_KEYWORD, "trojan", "\\btrojan\\b");
        rule(SignalCategory.MALWARE_KEYWORD, "backdoor", "\\bbackdoor\\b");
        rule(SignalCategory.MALWARE_KEYWORD, "rootkit", "\\brootkit\\b");
        rule(SignalCategory.MALWARE_KEYWORD, "keylogger", "\\bkeylogger\\b");
        rule(SignalCategory.MALWARE_KEYWORD, "ransomware", "\\bransomware\\b");
        rule(SignalCategory.MALWARE_KEYWORD, "spyware", "\\bspyware\\b");

        rule(SignalCategory.NETWORK_EXPLOIT, "exploit", "\\bexploit\\b");
        rule(SignalCategory.NETWORK_EXPLOIT, "shellcode", "\\bshellcode\\b");
        rule(SignalCategory.NETWORK_EXPLOIT, "payload", "\\bpayload\\b");
        rule(SignalCategory.NETWORK_EXPLOIT, "powershell", "\\bpowershell(\\.exe)?\\b");
        rule(SignalCategory.NETWORK_EXPLOIT, "cmd.exe", "\\bcmd\\.exe\\b");
        rule(SignalCategory.NETWORK_EXPLOIT, "eval call", "\\beval\\s*\\(");
        rule(SignalCategory.NETWORK_EXPLOIT, "exec call", "\\bexec\\s*\\(");
        rule(SignalCategory.NETWORK_EXPLOIT, "system call", "\\bsystem\\s*\\(");
        rule(SignalCategory.NETWORK_EXPLOIT, "reverse shell", "/bin/(ba)?sh\\s+-i|\\bnc\\s+-e\\b");
        rule(SignalCategory.NETWORK_EXPLOIT, "sql injection", "'\\s*or\\s+'?1'?\\s*=\\s*'?1|\\bunion\\s+select\\b");
        rule(SignalCategory.NETWORK_EXPLOIT, "script injection", "<script[^>]*>");
        rule(SignalCategory.NETWORK_EXPLOIT, "encoded command", "-enc(odedcommand)?\\s+[A-Za-z0-9+/=]{20,}");

        rule(SignalCategory.SOCIAL_ENGINEERING, "phishing", "\\bphishing\\b");
        rule(SignalCategory.SOCIAL_ENGINEERING, "account suspended", "\\baccount (has been |is )?suspended\\b");
        rule(SignalCategory.SOCIAL_ENGINEERING, "verify your account", "\\bverify your (account|identity|password)\\b");
        rule(SignalCategory.SOCIAL_ENGINEERING, "urgent action", "\\burgent(ly)? (action|response) required\\b");
        rule(SignalCategory.SOCIAL_ENGINEERING, "click here", "\\bclick here\\b");

        rule(SignalCategory.CRYPTO_ACTIVITY, "bitcoin", "\\bbitcoin\\b");
        rule(SignalCategory.CRYPTO_ACTIVITY, "wallet", "\\bwallet\\b");
        rule(SignalCategory.CRYPTO_ACTIVITY, "mining", "\\b(crypto)?mining\\b|\\bstratum\\+tcp://");
        rule(SignalCategory.CRYPTO_ACTIVITY, "monero", "\\bmonero\\b|\\bxmrig\\b");
        rule(SignalCategory.CRYPTO_ACTIVITY, "bitcoin address", "\\b(bc1|[13])[a-km-zA-HJ-NP-Z1-9]{25,39}\\b");
    }

    private static final Pattern URL = Pattern.compile("\\b(https?|ftp)://[^\\s\"'<>]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern IP_URL = Pattern.compile("\\b(https?|ftp)://\\d{1,3}(\\.\\d{1,3}){3}",
            Pattern.CASE_INSENSITIVE);

    private ContentSignals() {}

    private static void sensitive(String label, String regex) {
        rule(SignalCategory.SENSITIVE_DATA, label, regex);
    }

    private static void rule(SignalCategory category, String label, String regex) {
        RULES.add(new Rule(category, label, Pattern.compile(regex, Pattern.CASE_INSENSITIVE)));
    }

    /** Distinct tagged findings in first-seen rule order. */
    public static List<String> scan(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> findings = new LinkedHashSet<>();
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(text).find()) {
                findings.add(rule.category().tag(rule.label()));
            }
        }
        long urls = URL.matcher(text).results().count();
        if (urls > 0) {
            findings.add(SignalCategory.INFO.tag(urls + " URL(s) referenced"));
        }
        if (IP_URL.matcher(text).find()) {
            findings.add(SignalCategory.NETWORK_EXPLOIT.tag("URL with raw IP address"));
        }
        return new ArrayList<>(findings);
    }

    /** Finding counts per category, for metadata. */
    public static Map<String, Long> summarize(List<String> findings) {
        var summary = new TreeMap<String, Long>();
        for (String finding : findings) {
            summary.merge(SignalCategory.of(finding).name(), 1L, Long::sum);
        }
        return summary;
    }
}
