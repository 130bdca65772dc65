/**
 * ReverseTranspilerService.java
 *
 * 反向转译服务：把生成的 (可能被用户修改过的) 目标语言源码还原为 JibJab 标准源码。
 * 所有目标语言共用同一个逐行状态机，差异全部来自 LanguageProfile 中的识别正则。
 * 这是一种尽力而为的表层还原，无法识别的行会经过表达式改写后原样保留。
 */
package club.ppmc.battlescript.service;

import club.ppmc.battlescript.model.BlockStyle;
import club.ppmc.battlescript.model.DecompileState;
import club.ppmc.battlescript.model.LanguageProfile;
import club.ppmc.battlescript.model.LanguageProfile.MainWrapper;
import club.ppmc.battlescript.model.TargetId;
import club.ppmc.battlescript.util.CanonicalSyntax;
import club.ppmc.battlescript.util.ExpressionRewriter;
import club.ppmc.battlescript.util.TargetSourcePreprocessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ReverseTranspilerService {

    private final LanguageProfileService profileService;
    private final ExpressionRewriter rewriter;
    private final TargetSourcePreprocessor preprocessor;

    public ReverseTranspilerService(
            LanguageProfileService profileService,
            ExpressionRewriter rewriter,
            TargetSourcePreprocessor preprocessor) {
        this.profileService = profileService;
        this.rewriter = rewriter;
        this.preprocessor = preprocessor;
    }

    /**
     * 反向转译一段目标语言源码。
     *
     * @param code 目标语言源码。
     * @param target 源码所属的目标语言。
     * @return JibJab 源码 (以单个换行结尾)；目标语言不支持反向转译或没有产生任何内容时返回空。
     */
    public Optional<String> decompile(String code, TargetId target) {
        LanguageProfile profile = profileService.profile(target);
        if (!profile.reversible()) {
            log.debug("目标语言 {} 不支持反向转译。", target.id());
            return Optional.empty();
        }
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }

        var state = new DecompileState();
        for (String line : preprocessor.preprocess(code, profile)) {
            processLine(line, profile, state);
        }
        if (state.hasPendingSuccessReturn()) {
            state.flushPendingReturn(CanonicalSyntax.yeet(rewriter.rewrite(state.pendingReturnValue(), profile)));
        }
        state.closeAll(CanonicalSyntax.BLOCK_END);

        Optional<String> result = assemble(state.lines());
        log.debug("反向转译 {} 源码完成，产生 {} 行。", target.id(), state.lines().size());
        return result;
    }

    private void processLine(String raw, LanguageProfile profile, DecompileState state) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            if (state.hasPendingSuccessReturn()) {
                state.holdBlankLine();
            } else {
                state.emitBlank();
            }
            return;
        }

        boolean closer = isCloser(trimmed, profile);
        if (state.hasPendingSuccessReturn()) {
            if (closer && state.inMainWrapper() && state.atMainWrapperLevel()) {
                state.dropPendingReturn();
            } else {
                state.flushPendingReturn(
                        CanonicalSyntax.yeet(rewriter.rewrite(state.pendingReturnValue(), profile)));
            }
        }

        Matcher elseIf = match(profile.elseIfOpen(), trimmed);
        boolean branch = elseIf != null || match(profile.elseOpen(), trimmed) != null;
        int level = 0;
        if (profile.blockStyle() == BlockStyle.INDENT) {
            level = leadingSpaces(raw) / profile.indentWidth();
            // else 与 elif 要保留它所接续的块，由下面的分支处理关闭
            int keep = branch ? level + 1 : level;
            while (state.sourceDepth() > keep) {
                state.close(CanonicalSyntax.BLOCK_END);
            }
        }

        if (handleMainWrapper(trimmed, profile, state)) {
            return;
        }

        if (closer) {
            if (state.inMainWrapper() && state.atMainWrapperLevel()) {
                state.leaveMainWrapper();
            } else {
                state.close(CanonicalSyntax.BLOCK_END);
            }
            return;
        }

        if (trimmed.startsWith(profile.commentPrefix())) {
            state.emit(CanonicalSyntax.comment(trimmed.substring(profile.commentPrefix().length()).trim()));
            return;
        }

        Matcher m = match(profile.functionDef(), trimmed);
        if (m != null) {
            state.open(CanonicalSyntax.morph(m.group(1), stripParamTypes(m.group(2), profile)));
            return;
        }

        m = match(profile.forLoop(), trimmed);
        if (m != null) {
            state.open(CanonicalSyntax.loop(
                    m.group(1), rewriter.rewrite(m.group(2), profile), rewriter.rewrite(m.group(3), profile)));
            return;
        }

        m = match(profile.ifOpen(), trimmed);
        if (m != null) {
            state.open(CanonicalSyntax.when(rewriter.rewrite(m.group(1), profile)));
            return;
        }

        if (branch) {
            boolean closesPrevious = switch (profile.blockStyle()) {
                case KEYWORD -> true;
                case BRACE -> trimmed.startsWith("}");
                case INDENT -> state.sourceDepth() > level;
            };
            boolean chained = closesPrevious && state.closeBranch(CanonicalSyntax.BLOCK_END);
            state.open(CanonicalSyntax.ELSE, chained);
            if (elseIf != null) {
                state.open(CanonicalSyntax.when(rewriter.rewrite(elseIf.group(1), profile)), true);
            }
            return;
        }

        m = match(profile.returnStmt(), trimmed);
        if (m != null) {
            state.emit(CanonicalSyntax.yeet(rewriter.rewrite(m.group(1), profile)));
            return;
        }

        for (Pattern emit : profile.emitStatements()) {
            m = match(emit, trimmed);
            if (m != null) {
                state.emit(CanonicalSyntax.emit(rewriter.rewrite(firstGroup(m), profile)));
                return;
            }
        }

        for (Pattern bind : profile.bindStatements()) {
            m = match(bind, trimmed);
            if (m != null && !profile.reservedWords().contains(m.group(1))) {
                state.emit(CanonicalSyntax.bind(m.group(1), rewriter.rewrite(m.group(2), profile)));
                return;
            }
        }

        String fallback = trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        state.emit(rewriter.rewrite(fallback, profile));
    }

    /**
     * 处理主函数包装的入口行和合成的成功返回语句。
     *
     * @return 如果该行已被消费。
     */
    private boolean handleMainWrapper(String trimmed, LanguageProfile profile, DecompileState state) {
        MainWrapper wrapper = profile.mainWrapper();
        if (wrapper == null) {
            return false;
        }
        if (!state.inMainWrapper() && wrapper.open().matcher(trimmed).matches()) {
            state.enterMainWrapper();
            return true;
        }
        if (!state.inMainWrapper() || !state.atMainWrapperLevel()) {
            return false;
        }
        if (wrapper.innerOpen() != null && wrapper.innerOpen().matcher(trimmed).matches()) {
            state.enterMainWrapper();
            return true;
        }
        if (wrapper.successReturn() != null && wrapper.successReturn().equals(trimmed)) {
            Matcher m = match(profile.returnStmt(), trimmed);
            state.deferSuccessReturn(m != null ? m.group(1) : "0");
            return true;
        }
        return false;
    }

    private static boolean isCloser(String trimmed, LanguageProfile profile) {
        return profile.blockClose() != null && profile.blockClose().matcher(trimmed).matches();
    }

    /**
     * 去掉形参中的类型标注，只保留参数名，顺序不变。
     */
    static String stripParamTypes(String params, LanguageProfile profile) {
        if (params == null || params.isBlank()) {
            return "";
        }
        var names = new ArrayList<String>();
        for (String param : params.split(",")) {
            String p = param.trim();
            if (p.isEmpty() || "void".equals(p)) {
                continue;
            }
            String name = switch (profile.paramStyle()) {
                case UNTYPED -> p;
                case TYPE_FIRST -> {
                    String[] tokens = p.split("\\s+");
                    yield tokens[tokens.length - 1].replaceAll("^[*&]+", "").replace("[]", "");
                }
                case TYPE_AFTER_COLON -> {
                    int colon = p.indexOf(':');
                    String label = colon >= 0 ? p.substring(0, colon).trim() : p;
                    String[] tokens = label.split("\\s+");
                    yield tokens[tokens.length - 1];
                }
                case TYPE_LAST -> p.split("\\s+")[0];
            };
            names.add(name);
        }
        return String.join(", ", names);
    }

    private static Optional<String> assemble(List<String> lines) {
        int start = 0;
        int end = lines.size();
        while (start < end && lines.get(start).isBlank()) {
            start++;
        }
        while (end > start && lines.get(end - 1).isBlank()) {
            end--;
        }
        if (start == end) {
            return Optional.empty();
        }
        return Optional.of(String.join("\n", lines.subList(start, end)) + "\n");
    }

    private static Matcher match(Pattern pattern, String trimmed) {
        if (pattern == null) {
            return null;
        }
        Matcher m = pattern.matcher(trimmed);
        return m.matches() ? m : null;
    }

    private static String firstGroup(Matcher m) {
        for (int i = 1; i <= m.groupCount(); i++) {
            if (m.group(i) != null) {
                return m.group(i);
            }
        }
        return m.group();
    }

    private static int leadingSpaces(String raw) {
        int count = 0;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ' ') {
                count++;
            } else if (c == '\t') {
                count += 4;
            } else {
                break;
            }
        }
        return count;
    }
}
