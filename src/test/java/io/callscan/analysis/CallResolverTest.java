package io.callscan.analysis;

import io.callscan.GoProjectFixture;
import io.callscan.model.CallSite;
import io.callscan.model.CallTarget;
import io.callscan.model.CallTarget.CrossModuleCall;
import io.callscan.model.CallTarget.ExternalCall;
import io.callscan.model.CallTarget.LiteralInvocation;
import io.callscan.model.CallTarget.LocalCall;
import io.callscan.model.CallTarget.MethodCall;
import io.callscan.source.ProjectIndex;
import io.callscan.source.SourceIndexer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CallResolverTest {

    @TempDir
    Path tempDir;

    private ResolutionResult resolve(GoProjectFixture fixture) throws IOException {
        ProjectIndex index = new SourceIndexer().index(fixture.root());
        return new CallResolver().resolve(index);
    }

    private ResolutionResult resolveMain(String source) throws IOException {
        return resolve(GoProjectFixture.module(tempDir, "example.com/app").file("main.go", source));
    }

    @Test
    void resolve_functionWithoutCallsHasNoCallSites() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func quiet() int {
                x := 1
                return x + 2
            }
            """);

        assertThat(result.callSites("main.quiet")).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void resolve_bareIdentifierInSamePackageIsLocal() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func main() {
                helper()
            }

            func helper() {}
            """);

        List<CallSite> sites = result.callSites("main.main");
        assertThat(sites).hasSize(1);
        CallSite site = sites.get(0);
        assertThat(site.target()).isInstanceOf(LocalCall.class);
        assertThat(((LocalCall) site.target()).target().identity()).isEqualTo("main.helper");
        assertThat(site.line()).isEqualTo(4);
        assertThat(site.expression()).isEqualTo("helper()");
    }

    @Test
    void resolve_importedPackageCallIsExternalWithImportPath() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            import (
                "fmt"
                str "strings"
            )

            func main() {
                fmt.Println("hi")
                str.ToUpper("x")
            }
            """);

        List<CallSite> sites = result.callSites("main.main");
        assertThat(sites).extracting(CallSite::target).containsExactly(
            new ExternalCall("Println", "fmt", "fmt", CallTarget.Origin.IMPORTED),
            new ExternalCall("ToUpper", "str", "strings", CallTarget.Origin.IMPORTED));
        assertThat(sites.get(0).arguments()).containsExactly("\"hi\"");
    }

    @Test
    void resolve_selectorOnValueIsMethodCall() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func run(v Runner) {
                v.Fn()
            }
            """);

        assertThat(result.callSites("main.run")).extracting(CallSite::target)
            .containsExactly(new MethodCall("v", "Fn"));
    }

    @Test
    void resolve_fieldChainKeepsFullReceiver() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func (c *Client) Do() {
                c.Service.Execute()
            }
            """);

        assertThat(result.callSites("main/Client.Do")).extracting(CallSite::target)
            .containsExactly(new MethodCall("c.Service", "Execute"));
    }

    @Test
    void resolve_chainedCallIsSingleMethodCallWithOpaqueReceiver() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func chain(obj Builder) {
                obj.
                    Method().
                    AnotherMethod()
            }
            """);

        List<CallSite> sites = result.callSites("main.chain");
        assertThat(sites).hasSize(1);
        assertThat(sites.get(0).target()).isEqualTo(new MethodCall("obj.Method()", "AnotherMethod"));
        assertThat(sites.get(0).nested()).isEmpty();
    }

    @Test
    void resolve_argumentCallsAreNestedNotTopLevel() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func main() {
                Outer(Inner1(), Inner2(x))
            }

            func Outer(a, b int) {}
            func Inner1() int { return 1 }
            func Inner2(x int) int { return x }
            """);

        List<CallSite> sites = result.callSites("main.main");
        assertThat(sites).hasSize(1);
        assertThat(sites.get(0).target().calleeName()).isEqualTo("Outer");
        assertThat(sites.get(0).arguments()).containsExactly("Inner1()", "Inner2(x)");
        assertThat(sites.get(0).nested()).extracting(s -> s.target().calleeName())
            .containsExactly("Inner1", "Inner2");
        assertThat(result.allCallSites("main.main")).hasSize(3);
        assertThat(result.internalCallees("main.main"))
            .containsExactly("main.Outer", "main.Inner1", "main.Inner2");
    }

    @Test
    void resolve_literalInvocationNestsBodyCallsThenArgumentCalls() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            import "fmt"

            func main() {
                func(n int) {
                    fmt.Println(n)
                }(compute())
            }

            func compute() int { return 1 }
            """);

        List<CallSite> sites = result.callSites("main.main");
        assertThat(sites).hasSize(1);
        CallSite literal = sites.get(0);
        assertThat(literal.target()).isInstanceOf(LiteralInvocation.class);
        assertThat(literal.line()).isEqualTo(6);
        assertThat(literal.nested()).extracting(s -> s.target().calleeName())
            .containsExactly("fmt.Println", "compute");
    }

    @Test
    void resolve_goAndDeferUseStatementLine() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func main() {
                defer cleanup()
                go func() {
                    work()
                }()
            }

            func cleanup() {}
            func work() {}
            """);

        List<CallSite> sites = result.callSites("main.main");
        assertThat(sites).hasSize(2);
        assertThat(sites.get(0).target()).isInstanceOf(LocalCall.class);
        assertThat(sites.get(0).line()).isEqualTo(4);
        assertThat(sites.get(1).target()).isInstanceOf(LiteralInvocation.class);
        assertThat(sites.get(1).line()).isEqualTo(5);
        assertThat(sites.get(1).nested()).singleElement()
            .satisfies(s -> assertThat(s.line()).isEqualTo(6));
    }

    @Test
    void resolve_builtInsAndConversionsAreSkippedButTheirArgumentsAreNot() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            type ID string

            func main() {
                items := make([]int, 0)
                items = append(items, size())
                _ = ID(name())
                _ = len(items)
            }

            func size() int { return 0 }
            func name() string { return "" }
            """);

        assertThat(result.callSites("main.main")).extracting(s -> s.target().calleeName())
            .containsExactly("size", "name");
    }

    @Test
    void resolve_packageCallIntoProjectIsCrossModule() throws IOException {
        ResolutionResult result = resolve(GoProjectFixture.module(tempDir, "example.com/app")
            .file("main.go", """
                package main

                import "example.com/app/internal/store"

                func main() {
                    store.Open()
                    store.Close()
                }
                """)
            .file("internal/store/store.go", """
                package store

                func Open() {}
                """));

        List<CallSite> sites = result.callSites("main.main");
        assertThat(sites.get(0).target()).isInstanceOf(CrossModuleCall.class);
        CrossModuleCall open = (CrossModuleCall) sites.get(0).target();
        assertThat(open.target().identity()).isEqualTo("store.Open");
        assertThat(open.importPath()).isEqualTo("example.com/app/internal/store");
        assertThat(sites.get(1).target()).isEqualTo(
            new ExternalCall("Close", "store", "example.com/app/internal/store", CallTarget.Origin.MISSING));
    }

    @Test
    void resolve_dotImportResolvesBareIdentifier() throws IOException {
        ResolutionResult result = resolve(GoProjectFixture.module(tempDir, "example.com/app")
            .file("main.go", """
                package main

                import . "example.com/app/util"

                func main() {
                    Assist()
                }
                """)
            .file("util/util.go", """
                package util

                func Assist() {}
                """));

        assertThat(result.internalCallees("main.main")).containsExactly("util.Assist");
    }

    @Test
    void resolve_unknownBareIdentifierIsExternalUnknown() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func main() {
                handler := pick()
                handler()
            }
            """);

        assertThat(result.callSites("main.main")).extracting(CallSite::target).containsExactly(
            ExternalCall.unknown("pick"),
            ExternalCall.unknown("handler"));
        assertThat(result.externals("main.main")).hasSize(2);
    }

    @Test
    void resolve_parenthesizedCalleeIsUnwrapped() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func main() {
                (helper)()
            }

            func helper() {}
            """);

        assertThat(result.internalCallees("main.main")).containsExactly("main.helper");
    }

    @Test
    void resolve_genericInstantiationResolvesToFunction() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            func Map[T any](xs []T) []T { return xs }

            func main() {
                Map[int](nil)
            }
            """);

        assertThat(result.internalCallees("main.main")).containsExactly("main.Map");
    }

    @Test
    void resolve_sameNamedFunctionsInOtherPackagesAreNotLocal() throws IOException {
        ResolutionResult result = resolve(GoProjectFixture.module(tempDir, "example.com/app")
            .file("a/a.go", """
                package a

                func Run() {
                    helper()
                }
                """)
            .file("b/b.go", """
                package b

                func helper() {}
                """));

        assertThat(result.callSites("a.Run")).extracting(CallSite::target)
            .containsExactly(ExternalCall.unknown("helper"));
    }

    @Test
    void resolve_genericInstantiationThroughImportIsCrossModule() throws IOException {
        ResolutionResult result = resolve(GoProjectFixture.module(tempDir, "example.com/app")
            .file("main.go", """
                package main

                import "example.com/app/internal/store"

                func main() {
                    store.Do[int](1)
                    go store.Do[string]("x")
                }
                """)
            .file("internal/store/store.go", """
                package store

                func Do[T any](v T) T { return v }
                """));

        List<CallSite> sites = result.callSites("main.main");
        assertThat(sites).hasSize(2);
        assertThat(sites).extracting(CallSite::line).containsExactly(6, 7);
        assertThat(sites.get(0).target()).isInstanceOf(CrossModuleCall.class);
        assertThat(sites.get(0).arguments()).containsExactly("1");
        assertThat(result.internalCallees("main.main")).containsExactly("store.Do");
    }

    @Test
    void resolve_conversionToGenericTypeIsNotACallButItsOperandIs() throws IOException {
        ResolutionResult result = resolveMain("""
            package main

            type List[T any] []T

            func build() []int { return nil }

            func main() {
                _ = List[int](build())
            }
            """);

        assertThat(result.callSites("main.main")).extracting(CallSite::target)
            .singleElement().isInstanceOf(LocalCall.class);
        assertThat(result.internalCallees("main.main")).containsExactly("main.build");
    }

    @Test
    void resolve_bareCallNeverLandsInAnotherPackageWithTheSameName() throws IOException {
        ResolutionResult result = resolve(GoProjectFixture.module(tempDir, "example.com/app")
            .file("cmd/a/main.go", """
                package main

                func main() {
                    run()
                }

                func run() {}
                """)
            .file("cmd/b/main.go", """
                package main

                func main() {}

                func serve() {
                    run()
                }
                """));

        assertThat(result.callSites("cmd/b/main.serve")).extracting(CallSite::target)
            .containsExactly(ExternalCall.unknown("run"));
        assertThat(result.internalCallees("cmd/a/main.main")).containsExactly("cmd/a/main.run");
    }

    @Test
    void resolve_missingFunctionIsNotBorrowedFromSameNamedPackage() throws IOException {
        ResolutionResult result = resolve(GoProjectFixture.module(tempDir, "example.com/app")
            .file("internal/a/util/util.go", """
                package util

                func Missing() {}
                """)
            .file("internal/b/util/util.go", """
                package util

                func Other() {}
                """)
            .file("internal/other/other.go", """
                package other

                import "example.com/app/internal/b/util"

                func Go() {
                    util.Missing()
                    util.Other()
                }
                """));

        List<CallSite> sites = result.callSites("other.Go");
        assertThat(sites.get(0).target()).isEqualTo(
            new ExternalCall("Missing", "util", "example.com/app/internal/b/util", CallTarget.Origin.MISSING));
        CrossModuleCall other = (CrossModuleCall) sites.get(1).target();
        assertThat(other.target().packagePath()).isEqualTo("example.com/app/internal/b/util");
        assertThat(result.internalCallees("other.Go")).containsExactly("internal/b/util.Other");
    }
}
