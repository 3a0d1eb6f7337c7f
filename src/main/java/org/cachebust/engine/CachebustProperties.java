package org.cachebust.engine;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 缓存戳（cachebust）引擎的业务配置（{@code app.cachebust.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #projectDir} 是所有相对目录的基准；{@link #staticDirs} 与 {@link #codeDirs} 都相对它解析。</li>
 *   <li>{@link #staticDirs} 的顺序就是引用查找时的根目录优先顺序。</li>
 *   <li>{@link #multibust} 的占位符与替换值在启动时校验，非法配置直接导致启动失败。</li>
 *   <li>{@code init} 生成的 {@code cachebust.properties} 会通过 {@code spring.config.import} 覆盖这里的默认值。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.cachebust")
public class CachebustProperties {

    /**
     * 项目根目录（其余目录配置均相对该目录）。
     */
    @NotBlank
    private String projectDir = ".";

    /**
     * 静态资源根目录（按顺序查找）。
     */
    @NotEmpty
    private List<String> staticDirs = new ArrayList<>(List.of("."));

    /**
     * 视为静态资源的文件扩展名（不含点，大小写不敏感）。
     */
    @NotEmpty
    private List<String> staticFiletypes = new ArrayList<>(List.of(
            "png", "gif", "jpg", "jpeg", "ico", "webp", "svg",
            "js", "css", "swf",
            "mov", "avi", "mp4", "webm", "ogg", "ogv",
            "wav", "mp3", "opus",
            "woff", "woff2", "ttf", "eot"
    ));

    /**
     * 需要扫描引用的代码/文本目录。
     */
    @NotEmpty
    private List<String> codeDirs = new ArrayList<>(List.of("."));

    /**
     * 需要扫描的代码/文本文件扩展名（不含点，大小写不敏感）。
     */
    @NotEmpty
    private List<String> codeFiletypes = new ArrayList<>(List.of(
            "htm", "html", "jade", "pug", "erb", "haml", "txt", "md",
            "css", "sass", "less", "scss",
            "xml", "json", "yaml", "yml", "cfg", "ini",
            "js", "coffee", "dart", "ts", "jsx", "tsx", "vue",
            "py", "rb", "php", "java", "jsp", "pl", "cs", "lua", "go", "twig"
    ));

    /**
     * 不纳入静态资源索引的文件（glob，匹配文件名或相对项目根目录的路径，例如 {@code *.map}、{@code static/vendor/**}）。
     */
    @NotNull
    private List<String> staticExclude = new ArrayList<>();

    /**
     * 不扫描引用的代码文件（glob，规则同 {@link #staticExclude}，例如 {@code *.min.js}）。
     */
    @NotNull
    private List<String> codeExclude = new ArrayList<>();

    /**
     * 遍历时跳过的目录（glob，匹配目录名或相对项目根目录的路径）。
     */
    @NotNull
    private List<String> ignoreDirs = new ArrayList<>(List.of(
            "lib", "lib64", ".git", ".hg", ".svn", "node_modules"
    ));

    /**
     * 代码文件的字符编码（仅用于把引用路径解码成文件名；改写本身按字节进行）。
     */
    @NotBlank
    private String fileEncoding = "UTF-8";

    /**
     * 内容摘要算法：crc32 / md5 / sha1 / sha256。
     */
    @NotBlank
    private String hashFunction = "crc32";

    /**
     * 缓存戳长度（十六进制字符数），其中前 {@code min(4, length/2)} 位来自修改时间。
     */
    @Min(4)
    @Max(64)
    private int hashLength = 8;

    /**
     * 新增缓存戳时采用的形式：QUERY（{@code ?_cb_=...}）或 FILENAME（{@code app_cb_....js}）。
     */
    @NotNull
    private MarkerStyle markerStyle = MarkerStyle.QUERY;

    /**
     * 缓存戳标记字符串。
     */
    @NotBlank
    @jakarta.validation.constraints.Pattern(regexp = "[A-Za-z0-9_\\-]+")
    private String markerToken = "_cb_";

    /**
     * URL 字面量的分隔字符（空白字符始终视为分隔符；{@code =} 只分隔不归属路径）。
     */
    @NotNull
    private String delimiters = "\"'`()<>[],;|";

    /**
     * multibust 占位符 -> 替换值列表，例如 {@code app.cachebust.multibust.[{{lang}}]=en,de}。
     */
    @NotNull
    private Map<String, List<String>> multibust = new LinkedHashMap<>();

    /**
     * 超过该大小的代码文件不扫描。
     */
    @NotNull
    private DataSize maxFileSize = DataSize.ofMegabytes(2);

    /**
     * 遍历/扫描使用的工作线程数。
     */
    @Min(1)
    @Max(64)
    private int workerThreads = Math.min(4, Math.max(1, Runtime.getRuntime().availableProcessors()));

    /**
     * 是否跟随符号链接（开启时按真实路径去重，避免循环）。
     */
    private boolean followSymlinks = false;

    /**
     * 默认是否只预览不写入。
     */
    private boolean dryRun = false;

    /**
     * 报告中保留的告警条数上限。
     */
    @Min(1)
    @Max(100_000)
    private int maxWarnings = 200;

    @Valid
    @NotNull
    private Cli cli = new Cli();

    public String getProjectDir() {
        return projectDir;
    }

    public void setProjectDir(String projectDir) {
        this.projectDir = projectDir;
    }

    public List<String> getStaticDirs() {
        return staticDirs;
    }

    public void setStaticDirs(List<String> staticDirs) {
        this.staticDirs = staticDirs;
    }

    public List<String> getStaticFiletypes() {
        return staticFiletypes;
    }

    public void setStaticFiletypes(List<String> staticFiletypes) {
        this.staticFiletypes = staticFiletypes;
    }

    public List<String> getCodeDirs() {
        return codeDirs;
    }

    public void setCodeDirs(List<String> codeDirs) {
        this.codeDirs = codeDirs;
    }

    public List<String> getCodeFiletypes() {
        return codeFiletypes;
    }

    public void setCodeFiletypes(List<String> codeFiletypes) {
        this.codeFiletypes = codeFiletypes;
    }

    public List<String> getStaticExclude() {
        return staticExclude;
    }

    public void setStaticExclude(List<String> staticExclude) {
        this.staticExclude = staticExclude;
    }

    public List<String> getCodeExclude() {
        return codeExclude;
    }

    public void setCodeExclude(List<String> codeExclude) {
        this.codeExclude = codeExclude;
    }

    public List<String> getIgnoreDirs() {
        return ignoreDirs;
    }

    public void setIgnoreDirs(List<String> ignoreDirs) {
        this.ignoreDirs = ignoreDirs;
    }

    public String getFileEncoding() {
        return fileEncoding;
    }

    public void setFileEncoding(String fileEncoding) {
        this.fileEncoding = fileEncoding;
    }

    public String getHashFunction() {
        return hashFunction;
    }

    public void setHashFunction(String hashFunction) {
        this.hashFunction = hashFunction;
    }

    public int getHashLength() {
        return hashLength;
    }

    public void setHashLength(int hashLength) {
        this.hashLength = hashLength;
    }

    public MarkerStyle getMarkerStyle() {
        return markerStyle;
    }

    public void setMarkerStyle(MarkerStyle markerStyle) {
        this.markerStyle = markerStyle;
    }

    public String getMarkerToken() {
        return markerToken;
    }

    public void setMarkerToken(String markerToken) {
        this.markerToken = markerToken;
    }

    public String getDelimiters() {
        return delimiters;
    }

    public void setDelimiters(String delimiters) {
        this.delimiters = delimiters;
    }

    public Map<String, List<String>> getMultibust() {
        return multibust;
    }

    public void setMultibust(Map<String, List<String>> multibust) {
        this.multibust = multibust;
    }

    public DataSize getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(DataSize maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public boolean isFollowSymlinks() {
        return followSymlinks;
    }

    public void setFollowSymlinks(boolean followSymlinks) {
        this.followSymlinks = followSymlinks;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public int getMaxWarnings() {
        return maxWarnings;
    }

    public void setMaxWarnings(int maxWarnings) {
        this.maxWarnings = maxWarnings;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    /**
     * 批处理模式（{@code app.cachebust.cli.*}）：启动时直接执行一次并退出。
     */
    public static class Cli {

        /**
         * 启动时执行的模式；为空表示不执行（仅作为 MCP Server 运行）。
         */
        private RunMode mode;

        /**
         * 报告输出格式：text 或 json。
         */
        @NotBlank
        @jakarta.validation.constraints.Pattern(regexp = "text|json")
        private String format = "text";

        public RunMode getMode() {
            return mode;
        }

        public void setMode(RunMode mode) {
            this.mode = mode;
        }

        public String getFormat() {
            return format;
        }

        public void setFormat(String format) {
            this.format = format;
        }
    }
}
